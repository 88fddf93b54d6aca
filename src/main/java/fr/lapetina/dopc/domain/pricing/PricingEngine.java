package fr.lapetina.dopc.domain.pricing;

import fr.lapetina.dopc.domain.model.DistanceRange;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.Outcome;
import fr.lapetina.dopc.domain.model.VenueDynamicData;

import java.util.Optional;

/**
 * Pure pricing functions: distance, delivery fee, small order surcharge and total.
 *
 * All money values are integers in the lowest denomination of the local currency,
 * distances are integer meters.
 */
public final class PricingEngine {

    /** Mean Earth radius in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_000;

    private PricingEngine() {
        // Utility class
    }

    /**
     * Great-circle (haversine) distance between the user and the venue.
     *
     * @return distance in meters, rounded half-to-even
     */
    public static long distance(double userLat, double userLon, double venueLat, double venueLon) {
        double lat1 = Math.toRadians(userLat);
        double lat2 = Math.toRadians(venueLat);
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(venueLon) - Math.toRadians(userLon);

        double a = Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dLon / 2), 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return (long) Math.rint(EARTH_RADIUS_METERS * c);
    }

    /**
     * Looks up the delivery fee for a distance.
     *
     * <p>Ranges are scanned in the given order. A sentinel range ({@code max == 0}) whose
     * {@code min} is reached rejects the delivery; the first range containing the distance
     * prices it as {@code base_price + a + floor(b * distance / 10)}.
     *
     * @return the fee, or a {@link ErrorType#DISTANCE_EXCEEDED} / {@link ErrorType#NO_RANGE_FOUND} rejection;
     *         {@link ErrorType#UPSTREAM_DATA_INVALID} when the range parameters overflow a {@code long}
     */
    public static Outcome<Long> deliveryFee(long distance, VenueDynamicData pricing) {
        for (DistanceRange range : pricing.distanceRanges()) {
            if (range.isSentinel()) {
                if (distance >= range.min()) {
                    return Outcome.failure(ErrorType.DISTANCE_EXCEEDED,
                            "Delivery distance " + distance + "m exceeds maximum allowed distance "
                                    + range.min() + "m");
                }
                continue;
            }
            if (range.contains(distance)) {
                try {
                    long perDistance = Math.floorDiv(Math.multiplyExact(range.b(), distance), 10L);
                    long fee = Math.addExact(Math.addExact(pricing.basePrice(), range.a()), perDistance);
                    return Outcome.success(fee);
                } catch (ArithmeticException e) {
                    return Outcome.failure(ErrorType.UPSTREAM_DATA_INVALID,
                            "Delivery fee overflows for distance " + distance + "m");
                }
            }
        }
        return Outcome.failure(ErrorType.NO_RANGE_FOUND,
                "No suitable delivery fee range found for distance " + distance + "m");
    }

    public static long smallOrderSurcharge(long cartValue, long orderMinimum) {
        return Math.max(0, orderMinimum - cartValue);
    }

    /**
     * @throws ArithmeticException if the sum overflows
     */
    public static long totalPrice(long cartValue, long fee, long surcharge) {
        return Math.addExact(Math.addExact(cartValue, fee), surcharge);
    }

    /**
     * Validates a coordinate pair. NaN values are out of range.
     *
     * @return an error message, or empty if the pair is valid
     */
    public static Optional<String> coordinateError(double lat, double lon) {
        if (!(lat >= -90 && lat <= 90)) {
            return Optional.of("Invalid latitude: " + lat + ". Must be between -90 and 90");
        }
        if (!(lon >= -180 && lon <= 180)) {
            return Optional.of("Invalid longitude: " + lon + ". Must be between -180 and 180");
        }
        return Optional.empty();
    }

    public static boolean isValidCoordinate(double lat, double lon) {
        return coordinateError(lat, lon).isEmpty();
    }
}
