package fr.lapetina.dopc.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fr.lapetina.dopc.domain.pricing.PricingEngine;

import java.util.Objects;

/**
 * Priced delivery order returned to the client.
 * All amounts are in the lowest denomination of the local currency.
 *
 * <p>The total must equal the exact sum of cart value, delivery fee and
 * small order surcharge; construction fails otherwise.
 */
@JsonPropertyOrder({"total_price", "small_order_surcharge", "cart_value", "delivery"})
public record DeliveryPriceResponse(
        @JsonProperty("total_price") long totalPrice,
        @JsonProperty("small_order_surcharge") long smallOrderSurcharge,
        @JsonProperty("cart_value") long cartValue,
        @JsonProperty("delivery") Delivery delivery
) {
    public DeliveryPriceResponse {
        Objects.requireNonNull(delivery, "Delivery details are required");
        if (totalPrice <= 0) {
            throw new IllegalArgumentException("Total price must be greater than 0");
        }
        if (smallOrderSurcharge < 0) {
            throw new IllegalArgumentException("Small order surcharge cannot be negative");
        }
        if (cartValue <= 0) {
            throw new IllegalArgumentException("Cart value must be greater than 0");
        }
        long expected = sum(cartValue, delivery.fee(), smallOrderSurcharge);
        if (totalPrice != expected) {
            throw new IllegalArgumentException(
                    "Total price " + totalPrice + " does not match component sum " + expected);
        }
    }

    /**
     * Composes a response from its components, computing the total.
     */
    public static DeliveryPriceResponse of(long cartValue, long fee, long distance, long surcharge) {
        Delivery delivery = new Delivery(fee, distance);
        return new DeliveryPriceResponse(sum(cartValue, fee, surcharge), surcharge, cartValue, delivery);
    }

    private static long sum(long cartValue, long fee, long surcharge) {
        try {
            return PricingEngine.totalPrice(cartValue, fee, surcharge);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Total price exceeds maximum representable value");
        }
    }

    /**
     * Delivery part of the price.
     *
     * @param fee      delivery fee, at most 1,500,000
     * @param distance straight-line distance in meters, at most 2,000,000
     */
    @JsonPropertyOrder({"fee", "distance"})
    public record Delivery(
            @JsonProperty("fee") long fee,
            @JsonProperty("distance") long distance
    ) {
        public static final long MAX_FEE = 1_500_000;
        public static final long MAX_DISTANCE = 2_000_000;

        public Delivery {
            if (fee <= 0) {
                throw new IllegalArgumentException("Delivery fee must be greater than 0");
            }
            if (fee > MAX_FEE) {
                throw new IllegalArgumentException("Delivery fee exceeds maximum allowed value");
            }
            if (distance <= 0) {
                throw new IllegalArgumentException("Delivery distance must be greater than 0");
            }
            if (distance > MAX_DISTANCE) {
                throw new IllegalArgumentException("Delivery distance exceeds maximum allowed value");
            }
        }
    }
}
