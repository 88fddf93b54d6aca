package fr.lapetina.dopc.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.dopc.domain.model.DeliveryOrderRequest;
import fr.lapetina.dopc.domain.model.DeliveryPriceResponse;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.Outcome;
import fr.lapetina.dopc.infrastructure.upstream.ConnectionRole;
import fr.lapetina.dopc.infrastructure.upstream.VenueApiClient;
import fr.lapetina.dopc.support.VenuePayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class OrderPriceServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StubVenueApiClient venueApi;
    private OrderPriceService service;

    @BeforeEach
    void setUp() throws Exception {
        venueApi = new StubVenueApiClient(
                MAPPER.readTree(VenuePayloads.staticPayload()),
                MAPPER.readTree(VenuePayloads.dynamicPayload()));
        service = new OrderPriceService(venueApi, 4, null);
    }

    private static Map<String, String> parameters(String cartValue, String lat, String lon) {
        Map<String, String> parameters = new HashMap<>();
        parameters.put("venue_slug", VenuePayloads.VENUE_SLUG);
        parameters.put("cart_value", cartValue);
        parameters.put("user_lat", lat);
        parameters.put("user_lon", lon);
        return parameters;
    }

    @Nested
    @DisplayName("pricing")
    class Pricing {

        @Test
        @DisplayName("should price an order above the minimum without surcharge")
        void shouldPriceWithoutSurcharge() {
            Outcome<DeliveryPriceResponse> outcome = service.handle(parameters("1000", "60.17045", "24.93147"));

            assertThat(outcome.isSuccess()).isTrue();
            DeliveryPriceResponse response = outcome.value();
            assertThat(response.delivery().fee()).isEqualTo(390L);
            assertThat(response.delivery().distance()).isBetween(60L, 70L);
            assertThat(response.smallOrderSurcharge()).isZero();
            assertThat(response.totalPrice()).isEqualTo(1390L);
            assertThat(venueApi.fetchCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should add a small order surcharge below the minimum")
        void shouldAddSmallOrderSurcharge() {
            Outcome<DeliveryPriceResponse> outcome = service.handle(parameters("500", "60.17045", "24.93147"));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.value().delivery().fee()).isEqualTo(390L);
            assertThat(outcome.value().smallOrderSurcharge()).isEqualTo(500L);
            assertThat(outcome.value().totalPrice()).isEqualTo(1390L);
        }

        @Test
        @DisplayName("should reject a distance beyond every band")
        void shouldRejectDistanceBeyondBands() {
            // About 3.5 km north of the venue
            Outcome<DeliveryPriceResponse> outcome = service.handle(parameters("1000", "60.20244", "24.93087"));

            assertThat(outcome.errorType()).isEqualTo(ErrorType.NO_RANGE_FOUND);
            assertThat(outcome.errorType().getHttpStatus()).isEqualTo(400);
        }

        @Test
        @DisplayName("should report a zero distance as invalid venue data")
        void shouldRejectZeroDistance() {
            Outcome<DeliveryPriceResponse> outcome = service.handle(parameters("1000",
                    String.valueOf(VenuePayloads.VENUE_LAT), String.valueOf(VenuePayloads.VENUE_LON)));

            assertThat(outcome.errorType()).isEqualTo(ErrorType.UPSTREAM_DATA_INVALID);
            assertThat(outcome.errorMessage()).startsWith("Calculation error: ");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should reject invalid input before any fetch")
        void shouldRejectInvalidInputBeforeFetch() {
            Outcome<DeliveryPriceResponse> outcome = service.handle(parameters("1000", "95", "24.93147"));

            assertThat(outcome.errorType()).isEqualTo(ErrorType.INVALID_INPUT);
            assertThat(venueApi.fetchCount()).isZero();
            assertThat(service.getPeakInFlight()).isZero();
        }

        @Test
        @DisplayName("should propagate an upstream failure")
        void shouldPropagateUpstreamFailure() {
            venueApi.failWith(Outcome.failure(ErrorType.UPSTREAM_FAILURE, "Request failed with status: 404"));

            Outcome<DeliveryPriceResponse> outcome = service.handle(parameters("1000", "60.17045", "24.93147"));

            assertThat(outcome.errorType()).isEqualTo(ErrorType.UPSTREAM_FAILURE);
            assertThat(outcome.errorMessage()).isEqualTo("Request failed with status: 404");
            assertThat(venueApi.fetchCount()).isEqualTo(1);
            assertThat(service.getInFlight()).isZero();
        }

        @Test
        @DisplayName("should report a malformed dynamic payload")
        void shouldReportMalformedDynamicPayload() throws Exception {
            venueApi = new StubVenueApiClient(
                    MAPPER.readTree(VenuePayloads.staticPayload()),
                    MAPPER.readTree("{\"venue_raw\": {}}"));
            service = new OrderPriceService(venueApi, 4, null);

            Outcome<DeliveryPriceResponse> outcome = service.handle(parameters("1000", "60.17045", "24.93147"));

            assertThat(outcome.errorType()).isEqualTo(ErrorType.UPSTREAM_DATA_INVALID);
        }
    }

    @Nested
    @DisplayName("admission")
    class Admission {

        @Test
        @DisplayName("should never admit more requests than its capacity")
        void shouldNeverExceedCapacity() throws Exception {
            CountDownLatch gate = new CountDownLatch(1);
            venueApi.blockOn(gate);
            OrderPriceService limited = new OrderPriceService(venueApi, 2, null);
            DeliveryOrderRequest request = new DeliveryOrderRequest(VenuePayloads.VENUE_SLUG, 1000, 60.17045, 24.93147);

            ExecutorService executor = Executors.newFixedThreadPool(6);
            try {
                List<Future<Outcome<DeliveryPriceResponse>>> futures = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    futures.add(executor.submit(() -> limited.calculate(request)));
                }

                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (limited.getInFlight() < 2 && System.nanoTime() < deadline) {
                    Thread.sleep(10);
                }
                Thread.sleep(100);
                assertThat(limited.getInFlight()).isEqualTo(2);

                gate.countDown();
                for (Future<Outcome<DeliveryPriceResponse>> future : futures) {
                    assertThat(future.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
                }
            } finally {
                gate.countDown();
                executor.shutdownNow();
            }

            assertThat(limited.getPeakInFlight()).isEqualTo(2);
            assertThat(limited.getInFlight()).isZero();
        }
    }

    /**
     * Venue client answering from canned payloads.
     */
    private static final class StubVenueApiClient extends VenueApiClient {
        private final JsonNode staticPayload;
        private final JsonNode dynamicPayload;
        private final AtomicInteger fetches = new AtomicInteger(0);
        private volatile Outcome<JsonNode> failure;
        private volatile CountDownLatch gate;

        StubVenueApiClient(JsonNode staticPayload, JsonNode dynamicPayload) {
            super(null, Duration.ofSeconds(1), null);
            this.staticPayload = staticPayload;
            this.dynamicPayload = dynamicPayload;
        }

        void failWith(Outcome<JsonNode> failure) {
            this.failure = failure;
        }

        void blockOn(CountDownLatch gate) {
            this.gate = gate;
        }

        int fetchCount() {
            return fetches.get();
        }

        @Override
        public Outcome<JsonNode> fetch(ConnectionRole role, String venueSlug) {
            fetches.incrementAndGet();
            CountDownLatch latch = gate;
            if (latch != null) {
                try {
                    latch.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failure != null) {
                return failure;
            }
            return Outcome.success(role == ConnectionRole.STATIC ? staticPayload : dynamicPayload);
        }
    }
}
