package fr.lapetina.dopc.support;

import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import fr.lapetina.dopc.infrastructure.http.BackendHttpClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Backend client answering without network I/O.
 *
 * Forwards are answered with {@code 200 {"backend": id}} unless a status is set for
 * the backend; health probes succeed unless the backend is marked down.
 */
public class StubBackendHttpClient extends BackendHttpClient {

    private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    private final Set<String> down = ConcurrentHashMap.newKeySet();
    private final List<String> forwardedTo = new CopyOnWriteArrayList<>();

    public StubBackendHttpClient() {
        super("/api/v1/delivery-order-price", Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1));
    }

    public StubBackendHttpClient respondWith(BackendInstance backend, int status) {
        statuses.put(backend.getId(), status);
        return this;
    }

    public StubBackendHttpClient down(BackendInstance backend) {
        down.add(backend.getId());
        return this;
    }

    public StubBackendHttpClient up(BackendInstance backend) {
        down.remove(backend.getId());
        return this;
    }

    public List<String> getForwardedTo() {
        return forwardedTo;
    }

    @Override
    public void open(BackendInstance backend) {
    }

    @Override
    public CompletableFuture<ForwardResponse> forward(BackendInstance backend, ForwardRequest request) {
        forwardedTo.add(backend.getId());
        int status = statuses.getOrDefault(backend.getId(), 200);
        String body = "{\"backend\": \"" + backend.getId() + "\"}";
        return CompletableFuture.completedFuture(
                ForwardResponse.relayed(request.requestId(), status, body, backend.getId(), Instant.now()));
    }

    @Override
    public CompletableFuture<Boolean> healthCheck(BackendInstance backend) {
        return CompletableFuture.completedFuture(!down.contains(backend.getId()));
    }

    @Override
    public void close() {
    }
}
