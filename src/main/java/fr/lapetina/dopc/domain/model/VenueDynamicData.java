package fr.lapetina.dopc.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Dynamic venue data: the delivery pricing specification.
 * Distance ranges keep the order given by the upstream API.
 */
public record VenueDynamicData(
        long basePrice,
        List<DistanceRange> distanceRanges,
        long orderMinimumNoSurcharge
) {
    public VenueDynamicData {
        Objects.requireNonNull(distanceRanges, "Distance ranges are required");
        distanceRanges = List.copyOf(distanceRanges);
    }
}
