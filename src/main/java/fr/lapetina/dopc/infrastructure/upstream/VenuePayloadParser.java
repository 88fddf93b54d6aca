package fr.lapetina.dopc.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.dopc.domain.model.DistanceRange;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.Outcome;
import fr.lapetina.dopc.domain.model.VenueDynamicData;
import fr.lapetina.dopc.domain.model.VenueStaticData;
import fr.lapetina.dopc.domain.pricing.PricingEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strict parser for venue API payloads.
 *
 * Any deviation from the expected shape (missing field, wrong JSON type,
 * non-integral amount, coordinate out of range) yields
 * {@link ErrorType#UPSTREAM_DATA_INVALID}.
 */
public final class VenuePayloadParser {

    private VenuePayloadParser() {
        // Utility class
    }

    /**
     * Parses {@code {"venue_raw": {"location": {"coordinates": [lon, lat]}}}}.
     */
    public static Outcome<VenueStaticData> parseStatic(JsonNode payload) {
        try {
            JsonNode venueRaw = object(payload, "venue_raw");
            JsonNode location = object(venueRaw, "location");
            JsonNode coordinates = location.get("coordinates");
            if (coordinates == null || !coordinates.isArray() || coordinates.size() != 2) {
                throw new SchemaViolation("Invalid or missing coordinates");
            }
            JsonNode lonNode = coordinates.get(0);
            JsonNode latNode = coordinates.get(1);
            if (!lonNode.isNumber() || !latNode.isNumber()) {
                throw new SchemaViolation("Coordinates must be numeric");
            }
            double lat = latNode.doubleValue();
            double lon = lonNode.doubleValue();

            Optional<String> error = PricingEngine.coordinateError(lat, lon);
            if (error.isPresent()) {
                throw new SchemaViolation("Venue location invalid: " + error.get());
            }
            return Outcome.success(new VenueStaticData(lat, lon));
        } catch (SchemaViolation e) {
            return Outcome.failure(ErrorType.UPSTREAM_DATA_INVALID, e.getMessage());
        }
    }

    /**
     * Parses {@code venue_raw.delivery_specs}: the order minimum and the delivery pricing
     * (base price and ordered distance ranges).
     */
    public static Outcome<VenueDynamicData> parseDynamic(JsonNode payload) {
        try {
            JsonNode venueRaw = object(payload, "venue_raw");
            JsonNode deliverySpecs = object(venueRaw, "delivery_specs");
            long orderMinimum = integer(deliverySpecs, "order_minimum_no_surcharge");
            JsonNode pricing = object(deliverySpecs, "delivery_pricing");
            long basePrice = integer(pricing, "base_price");

            JsonNode ranges = pricing.get("distance_ranges");
            if (ranges == null || !ranges.isArray()) {
                throw new SchemaViolation("Invalid delivery specifications: 'distance_ranges' must be an array");
            }
            List<DistanceRange> distanceRanges = new ArrayList<>(ranges.size());
            for (JsonNode range : ranges) {
                if (!range.isObject()) {
                    throw new SchemaViolation("Invalid delivery specifications: distance range must be an object");
                }
                long min = integer(range, "min");
                long max = integer(range, "max");
                if (min < 0 || max < 0) {
                    throw new SchemaViolation("Invalid delivery specifications: negative distance bound");
                }
                distanceRanges.add(new DistanceRange(min, max, integer(range, "a"), integer(range, "b")));
            }
            return Outcome.success(new VenueDynamicData(basePrice, distanceRanges, orderMinimum));
        } catch (SchemaViolation e) {
            return Outcome.failure(ErrorType.UPSTREAM_DATA_INVALID, e.getMessage());
        }
    }

    private static JsonNode object(JsonNode parent, String field) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || !node.isObject()) {
            throw new SchemaViolation("Missing or invalid '" + field + "' in venue data");
        }
        return node;
    }

    private static long integer(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new SchemaViolation("Invalid delivery specifications: '" + field + "' must be an integer");
        }
        return node.longValue();
    }

    private static final class SchemaViolation extends RuntimeException {
        SchemaViolation(String message) {
            super(message, null, false, false);
        }
    }
}
