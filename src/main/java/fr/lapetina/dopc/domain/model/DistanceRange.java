package fr.lapetina.dopc.domain.model;

/**
 * One distance band of a venue's delivery pricing, in meters.
 *
 * @param min lower bound (inclusive)
 * @param max upper bound (inclusive); 0 marks the unbounded "reject from min" band
 * @param a   flat amount added to the base price
 * @param b   amount per started 10 meters, floor-divided
 */
public record DistanceRange(long min, long max, long a, long b) {

    public boolean isSentinel() {
        return max == 0;
    }

    public boolean contains(long distance) {
        return min <= distance && distance <= max;
    }
}
