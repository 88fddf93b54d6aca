package fr.lapetina.dopc.infrastructure.upstream;

/**
 * Role of a pooled upstream connection; each role has its own pool.
 */
public enum ConnectionRole {
    /** Venue location data */
    STATIC("static"),

    /** Venue delivery pricing data */
    DYNAMIC("dynamic");

    private final String pathSegment;

    ConnectionRole(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /**
     * Last path segment of the venue API resource served to this role.
     */
    public String getPathSegment() {
        return pathSegment;
    }
}
