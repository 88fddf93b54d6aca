package fr.lapetina.dopc.infrastructure.upstream;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One long-lived upstream connection occupying a pool slot.
 *
 * Wraps a dedicated HttpClient (HTTP/1.1 keep-alive) with its own executor so the
 * slot's network resources can be released on close. Thread-safe.
 */
public final class PooledConnection implements AutoCloseable {

    private static final AtomicInteger GENERATION = new AtomicInteger(0);

    private final ConnectionRole role;
    private final int slotIndex;
    private final int generation;
    private final ExecutorService executor;
    private final HttpClient httpClient;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean healthy = true;

    public PooledConnection(ConnectionRole role, int slotIndex, Duration connectTimeout) {
        this.role = role;
        this.slotIndex = slotIndex;
        this.generation = GENERATION.incrementAndGet();

        String threadName = "upstream-" + role.getPathSegment() + "-" + slotIndex + "-g" + generation;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .executor(executor)
                .build();
    }

    /**
     * Issues a GET request over this connection.
     *
     * @throws IOException if the connection is closed or the exchange fails
     */
    public HttpResponse<String> get(URI uri, Duration timeout) throws IOException, InterruptedException {
        if (closed.get()) {
            throw new IOException("Connection closed: " + this);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    public ConnectionRole getRole() {
        return role;
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    public int getGeneration() {
        return generation;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void markUnhealthy() {
        this.healthy = false;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the connection and releases its threads. Idempotent.
     *
     * <p>Later calls to {@link #get} fail fast. On JDK 17 {@link HttpClient} has no close method:
     * its idle keep-alive sockets and selector thread are released only once the client is
     * garbage collected, which this wrapper allows by dropping out of the pool.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            executor.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return "PooledConnection{" +
                "role=" + role +
                ", slot=" + slotIndex +
                ", generation=" + generation +
                ", healthy=" + healthy +
                ", closed=" + closed.get() +
                '}';
    }
}
