package fr.lapetina.dopc.domain.model;

import fr.lapetina.dopc.domain.pricing.PricingEngine;

/**
 * A client's request for a delivery order price.
 * Immutable; the compact constructor rejects invalid values.
 *
 * @param venueSlug venue identifier used against the upstream venue API
 * @param cartValue cart value in the lowest denomination of the local currency
 * @param userLat   user latitude in degrees
 * @param userLon   user longitude in degrees
 */
public record DeliveryOrderRequest(
        String venueSlug,
        long cartValue,
        double userLat,
        double userLon
) {
    /** Largest accepted cart value. */
    public static final long MAX_CART_VALUE = 1_000_000_000_000L;

    public DeliveryOrderRequest {
        if (venueSlug == null || venueSlug.isBlank()) {
            throw new IllegalArgumentException("Venue slug must be a non-empty string");
        }
        if (cartValue <= 0) {
            throw new IllegalArgumentException("Cart value must be greater than 0, got " + cartValue);
        }
        if (cartValue > MAX_CART_VALUE) {
            throw new IllegalArgumentException(
                    "Cart value must be at most " + MAX_CART_VALUE + ", got " + cartValue);
        }
        PricingEngine.coordinateError(userLat, userLon).ifPresent(error -> {
            throw new IllegalArgumentException(error);
        });
    }
}
