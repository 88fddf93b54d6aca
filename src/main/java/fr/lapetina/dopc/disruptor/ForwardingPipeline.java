package fr.lapetina.dopc.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.dopc.disruptor.exception.BackpressureException;
import fr.lapetina.dopc.disruptor.handlers.BackendSelectionHandler;
import fr.lapetina.dopc.disruptor.handlers.CompletionHandler;
import fr.lapetina.dopc.disruptor.handlers.DispatchHandler;
import fr.lapetina.dopc.domain.event.ForwardRequestEvent;
import fr.lapetina.dopc.domain.event.ForwardRequestEventFactory;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import fr.lapetina.dopc.infrastructure.health.BackendRegistry;
import fr.lapetina.dopc.infrastructure.http.BackendHttpClient;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disruptor pipeline forwarding client requests to the balancer's backends.
 *
 * Stages: select backend -> dispatch -> complete. Requests are published by the
 * listener's worker threads (multi-producer). A full ring buffer is reported to
 * the publisher immediately instead of queueing.
 */
public final class ForwardingPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ForwardingPipeline.class);

    private final Disruptor<ForwardRequestEvent> disruptor;
    private final RingBuffer<ForwardRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ForwardingPipeline(Builder builder) {
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new ForwardRequestEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("forwarding-pipeline"),
                ProducerType.MULTI,
                waitStrategy
        );

        disruptor
                .handleEventsWith(new BackendSelectionHandler(builder.registry))
                .then(new DispatchHandler(builder.httpClient, builder.metricsRegistry, builder.forwardTimeoutMs))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("ForwardingPipeline created: ringBufferSize={}, waitStrategy={}, forwardTimeoutMs={}",
                builder.ringBufferSize, builder.waitStrategy, builder.forwardTimeoutMs);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("ForwardingPipeline started");
        }
    }

    /**
     * Publishes a request to the ring buffer.
     *
     * @return future completed with the backend's response or a balancer-level error
     * @throws BackpressureException if the ring buffer is full
     */
    public CompletableFuture<ForwardResponse> submit(ForwardRequest request) {
        if (!running.get()) {
            CompletableFuture<ForwardResponse> future = new CompletableFuture<>();
            future.completeExceptionally(new IllegalStateException("Pipeline not running"));
            return future;
        }

        CompletableFuture<ForwardResponse> responseFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(ringBuffer.remainingCapacity());
        }

        try {
            ringBuffer.get(sequence).initialize(request, responseFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request submitted: requestId={}, sequence={}", request.requestId(), sequence);
        return responseFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down ForwardingPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("ForwardingPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("ForwardingPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static final class PipelineExceptionHandler implements ExceptionHandler<ForwardRequestEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, ForwardRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
            if (event.getResponseFuture() != null && !event.getResponseFuture().isDone()) {
                event.getResponseFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for ForwardingPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long forwardTimeoutMs = 5_000;
        private BackendRegistry registry;
        private BackendHttpClient httpClient;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder forwardTimeoutMs(long timeoutMs) {
            this.forwardTimeoutMs = timeoutMs;
            return this;
        }

        public Builder registry(BackendRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder httpClient(BackendHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder fromConfig(DopcConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.forwardTimeoutMs = config.getBalancer().getForwardTimeoutMs();
            return this;
        }

        public ForwardingPipeline build() {
            if (registry == null) {
                throw new IllegalStateException("BackendRegistry is required");
            }
            if (httpClient == null) {
                throw new IllegalStateException("BackendHttpClient is required");
            }
            return new ForwardingPipeline(this);
        }
    }
}
