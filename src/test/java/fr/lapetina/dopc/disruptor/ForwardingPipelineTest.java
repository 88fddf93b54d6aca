package fr.lapetina.dopc.disruptor;

import fr.lapetina.dopc.disruptor.exception.BackpressureException;
import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import fr.lapetina.dopc.infrastructure.health.BackendRegistry;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dopc.support.StubBackendHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForwardingPipelineTest {

    private BackendRegistry registry;
    private StubBackendHttpClient httpClient;
    private MetricsRegistry metrics;
    private ForwardingPipeline pipeline;
    private BackendInstance first;
    private BackendInstance second;

    @BeforeEach
    void setUp() {
        registry = new BackendRegistry();
        httpClient = new StubBackendHttpClient();
        metrics = new MetricsRegistry("dopc_test_balancer");
        first = new BackendInstance("localhost", 8001);
        second = new BackendInstance("localhost", 8002);
        registry.register(first);
        registry.register(second);

        pipeline = ForwardingPipeline.builder()
                .ringBufferSize(64)
                .forwardTimeoutMs(2_000)
                .registry(registry)
                .httpClient(httpClient)
                .metricsRegistry(metrics)
                .build();
        pipeline.start();
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
        metrics.close();
    }

    private ForwardResponse forward(String requestId) throws Exception {
        return pipeline.submit(ForwardRequest.of(requestId, "venue_slug=v&cart_value=1000"))
                .get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("forwarding")
    class Forwarding {

        @Test
        @DisplayName("should alternate between healthy backends")
        void shouldAlternateBetweenBackends() throws Exception {
            registry.markHealthy(first);
            registry.markHealthy(second);

            List<String> backendIds = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                backendIds.add(forward("req-" + i).backendId());
            }

            assertThat(backendIds).containsExactly("backend-8001", "backend-8002", "backend-8001", "backend-8002");
        }

        @Test
        @DisplayName("should relay the backend status and body verbatim")
        void shouldRelayStatusAndBody() throws Exception {
            registry.markHealthy(first);
            httpClient.respondWith(first, 400);

            ForwardResponse response = forward("req-400");

            assertThat(response.isRelayed()).isTrue();
            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(response.body()).isEqualTo("{\"backend\": \"backend-8001\"}");
            assertThat(response.requestId()).isEqualTo("req-400");
        }

        @Test
        @DisplayName("should never route to an unhealthy backend")
        void shouldNeverRouteToUnhealthyBackend() throws Exception {
            registry.markHealthy(first);
            registry.markHealthy(second);
            registry.markUnhealthy(first);

            for (int i = 0; i < 4; i++) {
                forward("req-" + i);
            }

            assertThat(httpClient.getForwardedTo()).containsOnly("backend-8002");
        }

        @Test
        @DisplayName("should answer 503 when no backend is healthy")
        void shouldAnswerWhenNoBackendHealthy() throws Exception {
            ForwardResponse response = forward("req-none");

            assertThat(response.isRelayed()).isFalse();
            assertThat(response.errorType()).isEqualTo(ErrorType.NO_HEALTHY_BACKENDS);
            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.errorMessage()).isEqualTo("No healthy services available");
            assertThat(httpClient.getForwardedTo()).isEmpty();
        }

        @Test
        @DisplayName("should answer with a balancer error when the backend never replies")
        void shouldTimeOutSilentBackend() throws Exception {
            pipeline.close();
            StubBackendHttpClient silent = new StubBackendHttpClient() {
                @Override
                public CompletableFuture<ForwardResponse> forward(BackendInstance backend, ForwardRequest request) {
                    return new CompletableFuture<>();
                }
            };
            pipeline = ForwardingPipeline.builder()
                    .ringBufferSize(64)
                    .forwardTimeoutMs(200)
                    .registry(registry)
                    .httpClient(silent)
                    .build();
            pipeline.start();
            registry.markHealthy(first);

            ForwardResponse response = forward("req-slow");

            assertThat(response.errorType()).isEqualTo(ErrorType.BALANCER_ERROR);
            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.errorMessage()).startsWith("Load balancer error: ");
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should reject non power of two ring buffer sizes")
        void shouldRejectInvalidRingBufferSize() {
            assertThatThrownBy(() -> ForwardingPipeline.builder().ringBufferSize(100))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should require a registry and a client")
        void shouldRequireCollaborators() {
            assertThatThrownBy(() -> ForwardingPipeline.builder().httpClient(httpClient).build())
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> ForwardingPipeline.builder().registry(registry).build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should fail submissions once closed")
        void shouldFailSubmissionsOnceClosed() {
            pipeline.close();

            CompletableFuture<ForwardResponse> future = pipeline.submit(ForwardRequest.of("req-closed", ""));

            assertThat(future).isCompletedExceptionally();
            assertThat(pipeline.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should report the ring buffer size and free capacity")
        void shouldReportCapacity() {
            assertThat(pipeline.getBufferSize()).isEqualTo(64);
            assertThat(pipeline.getRemainingCapacity()).isEqualTo(64L);
        }

        @Test
        @DisplayName("should refuse submissions once the ring buffer is full")
        void shouldRefuseWhenRingBufferFull() throws Exception {
            pipeline.close();
            CountDownLatch stall = new CountDownLatch(1);
            CountDownLatch dispatching = new CountDownLatch(1);
            StubBackendHttpClient stalled = new StubBackendHttpClient() {
                @Override
                public CompletableFuture<ForwardResponse> forward(BackendInstance backend, ForwardRequest request) {
                    dispatching.countDown();
                    try {
                        stall.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return super.forward(backend, request);
                }
            };
            pipeline = ForwardingPipeline.builder()
                    .ringBufferSize(4)
                    .registry(registry)
                    .httpClient(stalled)
                    .build();
            pipeline.start();
            registry.markHealthy(first);

            List<CompletableFuture<ForwardResponse>> accepted = new ArrayList<>();
            try {
                accepted.add(pipeline.submit(ForwardRequest.of("req-0", "")));
                assertThat(dispatching.await(5, TimeUnit.SECONDS)).isTrue();
                for (int i = 1; i < 4; i++) {
                    accepted.add(pipeline.submit(ForwardRequest.of("req-" + i, "")));
                }

                assertThatThrownBy(() -> pipeline.submit(ForwardRequest.of("req-overflow", "")))
                        .isInstanceOf(BackpressureException.class);
            } finally {
                stall.countDown();
            }

            for (CompletableFuture<ForwardResponse> future : accepted) {
                assertThat(future.get(5, TimeUnit.SECONDS).statusCode()).isEqualTo(200);
            }
        }
    }
}
