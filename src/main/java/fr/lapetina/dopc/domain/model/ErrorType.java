package fr.lapetina.dopc.domain.model;

/**
 * Error taxonomy for price requests and balancer forwarding.
 * Each type carries the HTTP status it is reported with.
 */
public enum ErrorType {
    /** Missing, malformed or out-of-range request parameters */
    INVALID_INPUT(400),

    /** Upstream venue API unreachable or answered with a non-2xx status */
    UPSTREAM_FAILURE(400),

    /** Upstream payload does not match the expected schema */
    UPSTREAM_DATA_INVALID(400),

    /** Delivery distance falls into the unbounded sentinel band */
    DISTANCE_EXCEEDED(400),

    /** No distance band matches the delivery distance */
    NO_RANGE_FOUND(400),

    /** Balancer has no backend in its healthy set */
    NO_HEALTHY_BACKENDS(503),

    /** Forwarding ring buffer is full */
    BACKPRESSURE(503),

    /** Transport failure while forwarding to a backend */
    BALANCER_ERROR(500),

    /** Internal system error */
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
