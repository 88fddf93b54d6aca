package fr.lapetina.dopc.domain.model;

/**
 * Static venue data needed for pricing: the venue location.
 * The upstream API delivers the pair as {@code [lon, lat]}.
 */
public record VenueStaticData(double latitude, double longitude) {
}
