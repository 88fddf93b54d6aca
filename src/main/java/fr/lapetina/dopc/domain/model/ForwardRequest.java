package fr.lapetina.dopc.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A client request received by the balancer, to be relayed to a backend.
 * Immutable and thread-safe.
 *
 * @param requestId request id, propagated to the backend
 * @param rawQuery  the client's query string, relayed verbatim (may be empty)
 * @param createdAt reception time
 */
public record ForwardRequest(String requestId, String rawQuery, Instant createdAt) {

    public ForwardRequest {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (rawQuery == null) {
            rawQuery = "";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static ForwardRequest of(String requestId, String rawQuery) {
        return new ForwardRequest(requestId, rawQuery, null);
    }
}
