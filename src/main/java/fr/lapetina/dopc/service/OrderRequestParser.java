package fr.lapetina.dopc.service;

import fr.lapetina.dopc.domain.model.DeliveryOrderRequest;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.Outcome;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns query parameters into a validated {@link DeliveryOrderRequest}.
 */
public final class OrderRequestParser {

    public static final String VENUE_SLUG = "venue_slug";
    public static final String CART_VALUE = "cart_value";
    public static final String USER_LAT = "user_lat";
    public static final String USER_LON = "user_lon";

    static final List<String> REQUIRED_PARAMETERS = List.of(VENUE_SLUG, CART_VALUE, USER_LAT, USER_LON);

    private OrderRequestParser() {
        // Utility class
    }

    /**
     * Parses and validates the request parameters.
     * Missing parameters are reported together, in declaration order.
     */
    public static Outcome<DeliveryOrderRequest> parse(Map<String, String> parameters) {
        List<String> missing = REQUIRED_PARAMETERS.stream()
                .filter(name -> !parameters.containsKey(name))
                .toList();
        if (!missing.isEmpty()) {
            return Outcome.failure(ErrorType.INVALID_INPUT,
                    "Missing required parameters: " + missing.stream().collect(Collectors.joining(", ")));
        }

        try {
            long cartValue = parseInteger(CART_VALUE, parameters.get(CART_VALUE));
            double userLat = parseNumber(USER_LAT, parameters.get(USER_LAT));
            double userLon = parseNumber(USER_LON, parameters.get(USER_LON));
            return Outcome.success(new DeliveryOrderRequest(
                    parameters.get(VENUE_SLUG), cartValue, userLat, userLon));
        } catch (IllegalArgumentException e) {
            return Outcome.failure(ErrorType.INVALID_INPUT, "Validation error: " + e.getMessage());
        }
    }

    private static long parseInteger(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'");
        }
    }

    private static double parseNumber(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got '" + value + "'");
        }
    }
}
