package fr.lapetina.dopc.infrastructure.metrics;

import fr.lapetina.dopc.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters by outcome and error type
 * - Pricing, upstream fetch and forwarding latency timers
 * - Connection replacement counters
 * - Gauges for admission, pool and backend state
 * - JVM and system metrics
 * - Prometheus exposition
 *
 * The balancer and every pricing instance own a separate registry.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> replacementCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> upstreamTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> forwardTimers = new ConcurrentHashMap<>();
    private final Timer pricingTimer;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.pricingTimer = Timer.builder(prefix + "_pricing_latency")
                .description("End-to-end latency of the pricing pipeline")
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("dopc");
    }

    /**
     * Increments the request counter for an outcome ("success" or an error type name).
     */
    public void incrementRequestCount(String outcome) {
        requestCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of handled requests")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType.name(), k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the duration of one pricing pipeline run.
     */
    public void recordPricingLatency(Duration latency) {
        pricingTimer.record(latency);
    }

    /**
     * Records an upstream fetch through a pooled connection.
     */
    public void recordUpstreamFetch(String role, boolean success, Duration latency) {
        String outcome = success ? "success" : "failure";
        upstreamTimers.computeIfAbsent(role + ":" + outcome, k ->
                Timer.builder(prefix + "_upstream_fetch_latency")
                        .description("Upstream venue API fetch latency")
                        .tag("role", role)
                        .tag("outcome", outcome)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a pooled connection replaced by the health sweep.
     */
    public void incrementConnectionReplacement(String role) {
        replacementCounters.computeIfAbsent(role, k ->
                Counter.builder(prefix + "_pool_replacements_total")
                        .description("Pooled upstream connections replaced after a failed probe")
                        .tag("role", role)
                        .register(registry)
        ).increment();
    }

    /**
     * Records a request relayed to a backend.
     */
    public void recordForward(String backendId, int statusCode, Duration latency) {
        String status = Integer.toString(statusCode);
        forwardTimers.computeIfAbsent(backendId + ":" + status, k ->
                Timer.builder(prefix + "_forward_latency")
                        .description("Latency of requests relayed to backends")
                        .tag("backend", backendId)
                        .tag("status", status)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers a gauge backed by a supplier.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers a gauge for backend health status.
     */
    public void registerBackendHealth(String backendId, Supplier<Number> healthValue) {
        Gauge.builder(prefix + "_backend_health", healthValue, s -> s.get().doubleValue())
                .description("Backend health status (0=UNHEALTHY, 1=STARTING, 2=HEALTHY)")
                .tag("backend", backendId)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
