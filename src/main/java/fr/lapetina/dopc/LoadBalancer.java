package fr.lapetina.dopc;

import fr.lapetina.dopc.disruptor.ForwardingPipeline;
import fr.lapetina.dopc.disruptor.exception.BackpressureException;
import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import fr.lapetina.dopc.infrastructure.health.BackendHealthChecker;
import fr.lapetina.dopc.infrastructure.health.BackendRegistry;
import fr.lapetina.dopc.infrastructure.http.BackendHttpClient;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dopc.launch.BackendHandle;
import fr.lapetina.dopc.launch.BackendLauncher;
import fr.lapetina.dopc.launch.InProcessBackendLauncher;
import fr.lapetina.dopc.launch.ProcessBackendLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Health-aware load balancer in front of N pricing backends.
 *
 * Owns the backends (launched on consecutive ports), their persistent clients,
 * the health checker and the forwarding pipeline.
 */
public class LoadBalancer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final DopcConfig config;
    private final BackendLauncher launcher;
    private final BackendRegistry registry;
    private final BackendHttpClient httpClient;
    private final BackendHealthChecker healthChecker;
    private final ForwardingPipeline pipeline;
    private final MetricsRegistry metricsRegistry;
    private final List<BackendHandle> handles = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    protected LoadBalancer(DopcConfig config, BackendLauncher launcher, BackendHttpClient httpClientOverride) {
        this.config = config;
        this.launcher = launcher;
        DopcConfig.BalancerConfig balancer = config.getBalancer();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix() + "_balancer");
        this.registry = new BackendRegistry();
        this.httpClient = httpClientOverride != null ? httpClientOverride : new BackendHttpClient(
                config.getGeneral().getEndpoint(),
                Duration.ofMillis(balancer.getConnectTimeoutMs()),
                Duration.ofMillis(balancer.getForwardTimeoutMs()),
                Duration.ofMillis(balancer.getHealthCheckTimeoutMs())
        );
        this.healthChecker = new BackendHealthChecker(
                registry,
                httpClient,
                Duration.ofMillis(balancer.getHealthCheckIntervalMs()),
                Duration.ofMillis(balancer.getHealthCheckTimeoutMs())
        );
        this.pipeline = ForwardingPipeline.builder()
                .fromConfig(config)
                .registry(registry)
                .httpClient(httpClient)
                .metricsRegistry(metricsRegistry)
                .build();

        metricsRegistry.registerGauge("healthy_backends", "Backends currently in rotation", registry::healthyCount);
        metricsRegistry.registerGauge("ring_buffer_remaining", "Free forwarding ring buffer slots",
                pipeline::getRemainingCapacity);
    }

    public LoadBalancer(DopcConfig config, BackendLauncher launcher) {
        this(config, launcher, null);
    }

    /**
     * Creates a balancer with the launcher selected by {@code balancer.launchMode}.
     *
     * @param configPath passed to child processes in {@code process} mode
     */
    public static LoadBalancer create(DopcConfig config, String configPath) {
        return new LoadBalancer(config, createLauncher(config, configPath));
    }

    static BackendLauncher createLauncher(DopcConfig config, String configPath) {
        String mode = config.getBalancer().getLaunchMode();
        return switch (mode.toLowerCase()) {
            case "in-process" -> new InProcessBackendLauncher(config);
            case "process" -> new ProcessBackendLauncher(configPath, config.getBalancer().getProcessStartupDelayMs());
            default -> throw new IllegalArgumentException("Unknown balancer.launchMode: " + mode);
        };
    }

    /**
     * Launches the backends, puts them all in rotation, then starts forwarding and
     * health checking.
     *
     * <p>A failed start releases everything the balancer owns; the instance cannot be
     * started again.
     *
     * @throws IOException if a backend cannot be launched; already launched ones are stopped
     */
    public LoadBalancer start() throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Load balancer already closed");
        }
        if (!running.compareAndSet(false, true)) {
            return this;
        }
        DopcConfig.BalancerConfig balancer = config.getBalancer();
        String host = config.getGeneral().getHost();
        log.info("Starting {} backends with launcher '{}' from port {}",
                balancer.getNumServices(), launcher.getName(), balancer.getServicePortStart());

        try {
            for (int i = 0; i < balancer.getNumServices(); i++) {
                // Port 0 lets each in-process backend bind an ephemeral port
                int port = balancer.getServicePortStart() == 0 ? 0 : balancer.getServicePortStart() + i;
                BackendHandle handle = launcher.launch(host, port);
                handles.add(handle);

                BackendInstance backend = new BackendInstance(host, handle.getPort());
                registry.register(backend);
                httpClient.open(backend);
                registry.markHealthy(backend);
                metricsRegistry.registerBackendHealth(backend.getId(), () -> switch (backend.getHealth()) {
                    case HEALTHY -> 2;
                    case STARTING -> 1;
                    case UNHEALTHY -> 0;
                });
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to launch backends, stopping the ones already started", e);
            closed.set(true);
            running.set(false);
            releaseResources();
            throw e;
        }

        pipeline.start();
        healthChecker.start();
        log.info("Load balancer started: backends={}, healthy={}", registry.size(), registry.healthyCount());
        return this;
    }

    /**
     * Relays a client request to the next healthy backend.
     *
     * @throws BackpressureException if the forwarding ring buffer is full
     */
    public CompletableFuture<ForwardResponse> forward(ForwardRequest request) {
        return pipeline.submit(request);
    }

    /**
     * Next healthy backend in rotation, as used by the forwarding pipeline.
     */
    public Optional<BackendInstance> selectNext() {
        return registry.selectNext();
    }

    public BackendRegistry getRegistry() {
        return registry;
    }

    public BackendHealthChecker getHealthChecker() {
        return healthChecker;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public long getForwardTimeoutMs() {
        return config.getBalancer().getForwardTimeoutMs();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops health checking and forwarding, closes the persistent clients and
     * terminates every backend.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        closed.set(true);
        log.info("Stopping load balancer...");
        releaseResources();
        log.info("Load balancer stopped");
    }

    private void releaseResources() {
        healthChecker.close();
        pipeline.close();
        httpClient.close();
        stopBackends();
        registry.clear();
        metricsRegistry.close();
    }

    private void stopBackends() {
        for (BackendHandle handle : handles) {
            try {
                handle.close();
            } catch (Exception e) {
                log.warn("Error stopping backend on port {}", handle.getPort(), e);
            }
        }
        handles.clear();
    }
}
