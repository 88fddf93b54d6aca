package fr.lapetina.dopc.infrastructure.http;

import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP client for the balancer's backends.
 *
 * Keeps one persistent HttpClient (HTTP/1.1 keep-alive) per backend, used both for
 * relaying client requests and for health probes. All calls are asynchronous.
 */
public class BackendHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHttpClient.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final String endpoint;
    private final Duration connectTimeout;
    private final Duration forwardTimeout;
    private final Duration healthCheckTimeout;

    public BackendHttpClient(
            String endpoint,
            Duration connectTimeout,
            Duration forwardTimeout,
            Duration healthCheckTimeout
    ) {
        this.endpoint = endpoint;
        this.connectTimeout = connectTimeout;
        this.forwardTimeout = forwardTimeout;
        this.healthCheckTimeout = healthCheckTimeout;
    }

    /**
     * Opens the persistent client of a backend. Idempotent.
     */
    public void open(BackendInstance backend) {
        sessions.computeIfAbsent(backend.getId(), id -> new Session(id, connectTimeout));
    }

    /**
     * Relays a client request to a backend's pricing endpoint.
     *
     * The backend's status code and body are returned verbatim. A transport failure
     * or timeout completes the future with a {@link ErrorType#BALANCER_ERROR} response,
     * never exceptionally.
     */
    public CompletableFuture<ForwardResponse> forward(BackendInstance backend, ForwardRequest request) {
        Instant start = Instant.now();
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(forwardUri(backend, request))
                    .timeout(forwardTimeout)
                    .header("Accept", "application/json")
                    .header("X-Request-ID", request.requestId())
                    .GET()
                    .build();

            log.debug("Forwarding request: requestId={}, backendId={}, uri={}",
                    request.requestId(), backend.getId(), httpRequest.uri());

            return session(backend).client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                    .thenApply(response -> ForwardResponse.relayed(
                            request.requestId(), response.statusCode(), response.body(),
                            backend.getId(), start))
                    .exceptionally(ex -> forwardFailure(backend, request, ex, start));
        } catch (Exception e) {
            return CompletableFuture.completedFuture(forwardFailure(backend, request, e, start));
        }
    }

    /**
     * Probes a backend's {@code /health} endpoint.
     *
     * @return true only for a 200 response; false on any other status or failure
     */
    public CompletableFuture<Boolean> healthCheck(BackendInstance backend) {
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(backend.getBaseUrl().resolve("/health"))
                    .timeout(healthCheckTimeout)
                    .GET()
                    .build();

            return session(backend).client.sendAsync(httpRequest, HttpResponse.BodyHandlers.discarding())
                    .thenApply(response -> response.statusCode() == 200)
                    .exceptionally(ex -> {
                        log.debug("Health probe failed: backendId={}, error={}",
                                backend.getId(), rootCause(ex).toString());
                        return false;
                    });
        } catch (Exception e) {
            log.debug("Health probe failed: backendId={}, error={}", backend.getId(), e.toString());
            return CompletableFuture.completedFuture(false);
        }
    }

    private URI forwardUri(BackendInstance backend, ForwardRequest request) {
        String query = request.rawQuery().isEmpty() ? "" : "?" + request.rawQuery();
        return URI.create(backend.getBaseUrl() + endpoint + query);
    }

    private Session session(BackendInstance backend) {
        return sessions.computeIfAbsent(backend.getId(), id -> new Session(id, connectTimeout));
    }

    private ForwardResponse forwardFailure(
            BackendInstance backend,
            ForwardRequest request,
            Throwable throwable,
            Instant start
    ) {
        Throwable cause = rootCause(throwable);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.warn("Forwarding failed: requestId={}, backendId={}, error={}",
                request.requestId(), backend.getId(), cause.toString());
        return ForwardResponse.error(request.requestId(), ErrorType.BALANCER_ERROR,
                "Load balancer error: " + detail, backend.getId(), start);
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Closes every persistent client.
     */
    @Override
    public void close() {
        sessions.values().forEach(Session::close);
        sessions.clear();
        log.info("Backend HTTP clients closed");
    }

    private static final class Session {
        private final ExecutorService executor;
        private final HttpClient client;

        Session(String backendId, Duration connectTimeout) {
            this.executor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "backend-client-" + backendId);
                t.setDaemon(true);
                return t;
            });
            this.client = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout)
                    .version(HttpClient.Version.HTTP_1_1)
                    .executor(executor)
                    .build();
        }

        void close() {
            executor.shutdownNow();
        }
    }
}
