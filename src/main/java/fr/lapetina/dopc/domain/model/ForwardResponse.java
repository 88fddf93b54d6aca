package fr.lapetina.dopc.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of forwarding a request through the balancer.
 *
 * On success it carries the backend's status code and body verbatim, whatever
 * that status is. On a balancer-level failure it carries the error type instead.
 */
public record ForwardResponse(
        String requestId,
        int statusCode,
        String body,
        String backendId,
        Duration latency,
        ErrorType errorType,
        String errorMessage
) {
    public ForwardResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isRelayed() {
        return errorType == null;
    }

    public static ForwardResponse relayed(
            String requestId,
            int statusCode,
            String body,
            String backendId,
            Instant startedAt
    ) {
        return new ForwardResponse(requestId, statusCode, body, backendId,
                Duration.between(startedAt, Instant.now()), null, null);
    }

    public static ForwardResponse error(
            String requestId,
            ErrorType errorType,
            String errorMessage,
            String backendId,
            Instant startedAt
    ) {
        return new ForwardResponse(requestId, errorType.getHttpStatus(), null, backendId,
                Duration.between(startedAt, Instant.now()), errorType, errorMessage);
    }
}
