package fr.lapetina.dopc.infrastructure.upstream;

import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Two fixed-size pools of long-lived upstream connections, one per {@link ConnectionRole}.
 *
 * Reads round-robin over the slots without blocking and without checking health:
 * a request may hit a failing slot until the background sweep replaces it.
 * The sweep probes every slot on a fixed delay and swaps failing connections
 * in place, keeping their slot index.
 */
public final class UpstreamConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UpstreamConnectionPool.class);

    private final String baseUrl;
    private final int poolSize;
    private final Duration healthCheckInterval;
    private final Duration connectTimeout;
    private final Duration probeTimeout;
    private final String probeVenueSlug;
    private final MetricsRegistry metricsRegistry;

    private final Map<ConnectionRole, AtomicReferenceArray<PooledConnection>> slots =
            new EnumMap<>(ConnectionRole.class);
    private final Map<ConnectionRole, AtomicInteger> cursors = new EnumMap<>(ConnectionRole.class);
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public UpstreamConnectionPool(
            String baseUrl,
            int poolSize,
            Duration healthCheckInterval,
            Duration connectTimeout,
            Duration probeTimeout,
            String probeVenueSlug,
            MetricsRegistry metricsRegistry
    ) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + poolSize);
        }
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.poolSize = poolSize;
        this.healthCheckInterval = healthCheckInterval;
        this.connectTimeout = connectTimeout;
        this.probeTimeout = probeTimeout;
        this.probeVenueSlug = probeVenueSlug;
        this.metricsRegistry = metricsRegistry;

        for (ConnectionRole role : ConnectionRole.values()) {
            slots.put(role, new AtomicReferenceArray<>(poolSize));
            cursors.put(role, new AtomicInteger(0));
        }

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "upstream-pool-sweep");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens every slot and starts the periodic health sweep.
     * The pool accepts {@link #acquire} calls only once every slot is installed.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Pool already closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        for (ConnectionRole role : ConnectionRole.values()) {
            AtomicReferenceArray<PooledConnection> pool = slots.get(role);
            for (int i = 0; i < poolSize; i++) {
                pool.set(i, openConnection(role, i));
            }
        }
        if (closed.get()) {
            return;
        }
        running.set(true);
        log.info("Upstream pool started: baseUrl={}, poolSize={}, healthCheckInterval={}",
                baseUrl, poolSize, healthCheckInterval);

        scheduler.scheduleWithFixedDelay(
                this::sweep,
                healthCheckInterval.toMillis(),
                healthCheckInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    /**
     * Returns the next connection of a role, round-robin.
     */
    public PooledConnection acquire(ConnectionRole role) {
        if (!running.get()) {
            throw new IllegalStateException("Pool is not running");
        }
        int index = Math.floorMod(cursors.get(role).getAndIncrement(), poolSize);
        return slots.get(role).get(index);
    }

    /**
     * Probes every slot once and replaces the failing ones.
     *
     * @return number of replaced slots
     */
    public int checkAllSlots() {
        if (!running.get()) {
            return 0;
        }
        int replaced = 0;
        for (ConnectionRole role : ConnectionRole.values()) {
            AtomicReferenceArray<PooledConnection> pool = slots.get(role);
            for (int i = 0; i < poolSize && running.get(); i++) {
                PooledConnection connection = pool.get(i);
                if (!probe(connection)) {
                    log.warn("Replacing unhealthy {} connection: slot={}", role.getPathSegment(), i);
                    replace(role, i, connection);
                    replaced++;
                }
            }
        }
        log.debug("Pool sweep finished: replaced={}", replaced);
        return replaced;
    }

    private void sweep() {
        try {
            checkAllSlots();
        } catch (Exception e) {
            // Keep the schedule alive; the next run retries
            log.error("Error in upstream pool sweep", e);
        }
    }

    boolean probe(PooledConnection connection) {
        URI uri = venueUri(probeVenueSlug, connection.getRole());
        try {
            HttpResponse<String> response = connection.get(uri, probeTimeout);
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return true;
            }
            log.warn("Health probe failed: connection={}, status={}", connection, status);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Health probe interrupted: connection={}", connection);
        } catch (Exception e) {
            log.warn("Health probe error: connection={}, error={}", connection, e.toString());
        }
        connection.markUnhealthy();
        return false;
    }

    private void replace(ConnectionRole role, int index, PooledConnection old) {
        try {
            old.close();
        } catch (Exception e) {
            log.debug("Ignoring error while closing {}: {}", old, e.toString());
        }
        PooledConnection fresh = openConnection(role, index);
        slots.get(role).set(index, fresh);
        if (metricsRegistry != null) {
            metricsRegistry.incrementConnectionReplacement(role.getPathSegment());
        }
        log.info("Replaced {} connection at slot {}: generation {} -> {}",
                role.getPathSegment(), index, old.getGeneration(), fresh.getGeneration());
    }

    private PooledConnection openConnection(ConnectionRole role, int index) {
        return new PooledConnection(role, index, connectTimeout);
    }

    /**
     * Builds the venue API resource URI for a role.
     */
    public URI venueUri(String venueSlug, ConnectionRole role) {
        String encoded = URLEncoder.encode(venueSlug, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(baseUrl + "/venues/" + encoded + "/" + role.getPathSegment());
    }

    /**
     * Returns the connection currently installed in a slot.
     */
    public PooledConnection getSlot(ConnectionRole role, int index) {
        return slots.get(role).get(index);
    }

    public int getPoolSize() {
        return poolSize;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Cancels the sweep and closes every slot.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        for (ConnectionRole role : ConnectionRole.values()) {
            AtomicReferenceArray<PooledConnection> pool = slots.get(role);
            for (int i = 0; i < poolSize; i++) {
                PooledConnection connection = pool.get(i);
                if (connection != null) {
                    connection.close();
                }
            }
        }
        log.info("Upstream pool closed");
    }

    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Upstream base URL is required");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
