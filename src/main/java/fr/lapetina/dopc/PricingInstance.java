package fr.lapetina.dopc;

import fr.lapetina.dopc.api.PricingHttpServer;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dopc.infrastructure.upstream.UpstreamConnectionPool;
import fr.lapetina.dopc.infrastructure.upstream.VenueApiClient;
import fr.lapetina.dopc.service.OrderPriceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One pricing backend: its own upstream pool, admission gate, metrics and listener.
 * Instances share nothing, so each is an independent failure domain.
 *
 * <p>Usage:
 * <pre>{@code
 * try (PricingInstance instance = PricingInstance.create(config, "localhost", 8001).start()) {
 *     // serve...
 * }
 * }</pre>
 */
public class PricingInstance implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PricingInstance.class);

    private final DopcConfig config;
    private final String host;
    private final int requestedPort;
    private final MetricsRegistry metricsRegistry;
    private final UpstreamConnectionPool pool;
    private final OrderPriceService service;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile PricingHttpServer httpServer;
    private volatile int boundPort;

    protected PricingInstance(DopcConfig config, String host, int port) {
        this.config = config;
        this.host = host;
        this.requestedPort = port;

        DopcConfig.UpstreamConfig upstream = config.getUpstream();
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.pool = new UpstreamConnectionPool(
                upstream.effectiveBaseUrl(),
                upstream.getPoolSize(),
                Duration.ofMillis(upstream.getHealthCheckIntervalMs()),
                Duration.ofMillis(upstream.getConnectTimeoutMs()),
                Duration.ofMillis(upstream.getRequestTimeoutMs()),
                upstream.getProbeVenueSlug(),
                metricsRegistry
        );
        VenueApiClient venueApiClient = new VenueApiClient(
                pool, Duration.ofMillis(upstream.getRequestTimeoutMs()), metricsRegistry);
        this.service = new OrderPriceService(
                venueApiClient, config.getService().getMaxConcurrentRequests(), metricsRegistry);
    }

    public static PricingInstance create(DopcConfig config, String host, int port) {
        return new PricingInstance(config, host, port);
    }

    /**
     * Opens the upstream pool and binds the listener.
     *
     * <p>An instance starts at most once: a failed start closes the pool and the metrics
     * registry, and the instance cannot be started again. Create a new one to retry.
     *
     * @throws IOException if the listener cannot be bound
     */
    public PricingInstance start() throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Pricing instance already closed");
        }
        if (!running.compareAndSet(false, true)) {
            return this;
        }
        pool.start();
        try {
            PricingHttpServer server = new PricingHttpServer(
                    host,
                    requestedPort,
                    config.getGeneral().getEndpoint(),
                    config.getServer(),
                    service,
                    metricsRegistry
            );
            server.start();
            this.httpServer = server;
            this.boundPort = server.getPort();
        } catch (IOException e) {
            log.error("Failed to bind pricing listener: host={}, port={}", host, requestedPort);
            closed.set(true);
            running.set(false);
            pool.close();
            metricsRegistry.close();
            throw e;
        }
        log.info("Pricing instance started: port={}, upstream={}, poolSize={}, capacity={}",
                getPort(), pool.getBaseUrl(), pool.getPoolSize(), service.getCapacity());
        return this;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Bound port once started, the requested port before.
     */
    public int getPort() {
        return boundPort != 0 ? boundPort : requestedPort;
    }

    public OrderPriceService getService() {
        return service;
    }

    public UpstreamConnectionPool getPool() {
        return pool;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        closed.set(true);
        log.info("Stopping pricing instance: port={}", getPort());

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing pricing listener", e);
        }

        try {
            pool.close();
        } catch (Exception e) {
            log.warn("Error closing upstream pool", e);
        }

        metricsRegistry.close();
        log.info("Pricing instance stopped");
    }
}
