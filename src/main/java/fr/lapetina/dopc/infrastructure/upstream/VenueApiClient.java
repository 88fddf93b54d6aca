package fr.lapetina.dopc.infrastructure.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.Outcome;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;

/**
 * Client for the upstream venue API.
 *
 * Every fetch goes through a connection taken from the {@link UpstreamConnectionPool}
 * for the requested role. Failures are reported as {@link Outcome} values, never thrown.
 */
public class VenueApiClient {

    private static final Logger log = LoggerFactory.getLogger(VenueApiClient.class);

    private final UpstreamConnectionPool pool;
    private final Duration requestTimeout;
    private final MetricsRegistry metricsRegistry;
    private final ObjectMapper objectMapper;

    public VenueApiClient(
            UpstreamConnectionPool pool,
            Duration requestTimeout,
            MetricsRegistry metricsRegistry
    ) {
        this.pool = pool;
        this.requestTimeout = requestTimeout;
        this.metricsRegistry = metricsRegistry;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Fetches the venue resource of a role and parses it as JSON.
     *
     * @param role      which venue resource to fetch
     * @param venueSlug venue identifier
     * @return the JSON document, or an upstream failure
     */
    public Outcome<JsonNode> fetch(ConnectionRole role, String venueSlug) {
        PooledConnection connection = pool.acquire(role);
        URI uri = pool.venueUri(venueSlug, role);
        Instant start = Instant.now();

        Outcome<JsonNode> outcome = get(connection, uri);

        Duration latency = Duration.between(start, Instant.now());
        if (metricsRegistry != null) {
            metricsRegistry.recordUpstreamFetch(role.getPathSegment(), outcome.isSuccess(), latency);
        }
        if (outcome.isSuccess()) {
            log.debug("Venue fetch succeeded: role={}, venue={}, slot={}, latencyMs={}",
                    role.getPathSegment(), venueSlug, connection.getSlotIndex(), latency.toMillis());
        } else {
            log.warn("Venue fetch failed: role={}, venue={}, slot={}, error={}",
                    role.getPathSegment(), venueSlug, connection.getSlotIndex(), outcome.errorMessage());
        }
        return outcome;
    }

    private Outcome<JsonNode> get(PooledConnection connection, URI uri) {
        HttpResponse<String> response;
        try {
            response = connection.get(uri, requestTimeout);
        } catch (HttpTimeoutException e) {
            return Outcome.failure(ErrorType.UPSTREAM_FAILURE, "Request timed out");
        } catch (IOException e) {
            return Outcome.failure(ErrorType.UPSTREAM_FAILURE, "Request error: " + describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(ErrorType.INTERNAL_ERROR, "Interrupted while fetching venue data");
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            return Outcome.failure(ErrorType.UPSTREAM_FAILURE, "Request failed with status: " + status);
        }

        try {
            return Outcome.success(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            return Outcome.failure(ErrorType.UPSTREAM_DATA_INVALID,
                    "Venue API returned malformed JSON: " + e.getOriginalMessage());
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
