package fr.lapetina.dopc.infrastructure.health;

import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.infrastructure.http.BackendHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for the balancer's backends.
 *
 * Periodically probes every registered backend's {@code /health} endpoint.
 * A 200 puts the backend in the healthy set; anything else takes it out.
 */
public final class BackendHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthChecker.class);

    private final BackendRegistry registry;
    private final BackendHttpClient httpClient;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BackendHealthChecker(
            BackendRegistry registry,
            BackendHttpClient httpClient,
            Duration checkInterval,
            Duration probeTimeout
    ) {
        this.registry = registry;
        this.httpClient = httpClient;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backend-health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Backend health checker started with interval: {}", checkInterval);
        }
    }

    private void runCycle() {
        try {
            checkAllBackends();
        } catch (Exception e) {
            log.error("Error in backend health check cycle", e);
        }
    }

    /**
     * Probes every backend once and waits for all probes to settle.
     */
    public void checkAllBackends() {
        if (!running.get()) {
            return;
        }

        List<BackendInstance> backends = registry.getAllBackends();
        log.debug("Starting health check cycle: backendCount={}", backends.size());

        CompletableFuture<?>[] probes = backends.stream()
                .map(this::checkBackend)
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(probes).join();
    }

    /**
     * Probes one backend and applies the result.
     */
    public CompletableFuture<Void> checkBackend(BackendInstance backend) {
        return httpClient.healthCheck(backend)
                .completeOnTimeout(false, probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((healthy, ex) -> {
                    backend.markChecked(Instant.now());
                    if (ex == null && Boolean.TRUE.equals(healthy)) {
                        registry.markHealthy(backend);
                    } else {
                        log.warn("Backend does not respond: backendId={}, url={}",
                                backend.getId(), backend.getBaseUrl());
                        registry.markUnhealthy(backend);
                    }
                    return null;
                });
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Backend health checker stopped");
        }
    }
}
