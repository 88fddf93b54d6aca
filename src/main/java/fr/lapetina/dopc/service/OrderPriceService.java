package fr.lapetina.dopc.service;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.dopc.domain.model.DeliveryOrderRequest;
import fr.lapetina.dopc.domain.model.DeliveryPriceResponse;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.Outcome;
import fr.lapetina.dopc.domain.model.VenueDynamicData;
import fr.lapetina.dopc.domain.model.VenueStaticData;
import fr.lapetina.dopc.domain.pricing.PricingEngine;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dopc.infrastructure.upstream.ConnectionRole;
import fr.lapetina.dopc.infrastructure.upstream.VenueApiClient;
import fr.lapetina.dopc.infrastructure.upstream.VenuePayloadParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prices delivery orders.
 *
 * Each call runs the pipeline: validate, take an admission permit, fetch venue static
 * and dynamic data, compute distance, fee and surcharge. At most {@code capacity}
 * pipelines run at once; further callers wait for a permit, in arrival order.
 */
public class OrderPriceService {

    private static final Logger log = LoggerFactory.getLogger(OrderPriceService.class);

    private final VenueApiClient venueApiClient;
    private final MetricsRegistry metricsRegistry;
    private final int capacity;
    private final Semaphore admission;
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger peakInFlight = new AtomicInteger(0);

    public OrderPriceService(VenueApiClient venueApiClient, int capacity, MetricsRegistry metricsRegistry) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.venueApiClient = venueApiClient;
        this.capacity = capacity;
        this.metricsRegistry = metricsRegistry;
        this.admission = new Semaphore(capacity, true);

        if (metricsRegistry != null) {
            metricsRegistry.registerGauge("in_flight", "Pricing requests currently admitted", inFlight::get);
            metricsRegistry.registerGauge("capacity", "Maximum concurrently admitted pricing requests",
                    () -> capacity);
        }
    }

    /**
     * Prices a request given as raw query parameters.
     * Invalid input is rejected before any permit is taken or network call made.
     */
    public Outcome<DeliveryPriceResponse> handle(Map<String, String> parameters) {
        Outcome<DeliveryOrderRequest> request = OrderRequestParser.parse(parameters);
        if (request.isFailure()) {
            log.warn("Rejected request: error={}", request.errorMessage());
            record(request.errorType());
            return request.propagate();
        }
        return calculate(request.value());
    }

    /**
     * Prices a validated request. Blocks while the service is at capacity.
     */
    public Outcome<DeliveryPriceResponse> calculate(DeliveryOrderRequest request) {
        try {
            admission.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record(ErrorType.INTERNAL_ERROR);
            return Outcome.failure(ErrorType.INTERNAL_ERROR, "Interrupted while waiting for admission");
        }

        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        Instant start = Instant.now();
        try {
            log.info("Processing request: venue={}, cartValue={}, inFlight={}/{}",
                    request.venueSlug(), request.cartValue(), current, capacity);

            Outcome<DeliveryPriceResponse> outcome = price(request);

            Duration latency = Duration.between(start, Instant.now());
            if (metricsRegistry != null) {
                metricsRegistry.recordPricingLatency(latency);
            }
            if (outcome.isSuccess()) {
                DeliveryPriceResponse response = outcome.value();
                log.info("Priced request: venue={}, totalPrice={}, distance={}, fee={}, surcharge={}, latencyMs={}",
                        request.venueSlug(), response.totalPrice(), response.delivery().distance(),
                        response.delivery().fee(), response.smallOrderSurcharge(), latency.toMillis());
            } else {
                log.warn("Pricing failed: venue={}, errorType={}, error={}, latencyMs={}",
                        request.venueSlug(), outcome.errorType(), outcome.errorMessage(), latency.toMillis());
            }
            record(outcome.errorType());
            return outcome;
        } finally {
            inFlight.decrementAndGet();
            admission.release();
        }
    }

    private Outcome<DeliveryPriceResponse> price(DeliveryOrderRequest request) {
        Outcome<JsonNode> staticPayload = venueApiClient.fetch(ConnectionRole.STATIC, request.venueSlug());
        if (staticPayload.isFailure()) {
            return staticPayload.propagate();
        }
        Outcome<VenueStaticData> venue = VenuePayloadParser.parseStatic(staticPayload.value());
        if (venue.isFailure()) {
            return venue.propagate();
        }

        Outcome<JsonNode> dynamicPayload = venueApiClient.fetch(ConnectionRole.DYNAMIC, request.venueSlug());
        if (dynamicPayload.isFailure()) {
            return dynamicPayload.propagate();
        }
        Outcome<VenueDynamicData> pricing = VenuePayloadParser.parseDynamic(dynamicPayload.value());
        if (pricing.isFailure()) {
            return pricing.propagate();
        }

        long distance = PricingEngine.distance(
                request.userLat(), request.userLon(),
                venue.value().latitude(), venue.value().longitude());

        Outcome<Long> fee = PricingEngine.deliveryFee(distance, pricing.value());
        if (fee.isFailure()) {
            return fee.propagate();
        }

        long surcharge = PricingEngine.smallOrderSurcharge(
                request.cartValue(), pricing.value().orderMinimumNoSurcharge());
        try {
            return Outcome.success(DeliveryPriceResponse.of(request.cartValue(), fee.value(), distance, surcharge));
        } catch (IllegalArgumentException e) {
            return Outcome.failure(ErrorType.UPSTREAM_DATA_INVALID, "Calculation error: " + e.getMessage());
        }
    }

    private void record(ErrorType errorType) {
        if (metricsRegistry == null) {
            return;
        }
        if (errorType == null) {
            metricsRegistry.incrementRequestCount("success");
        } else {
            metricsRegistry.incrementRequestCount(errorType.name());
            metricsRegistry.incrementErrorCount(errorType);
        }
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Highest number of simultaneously admitted requests observed so far.
     */
    public int getPeakInFlight() {
        return peakInFlight.get();
    }

    public int getCapacity() {
        return capacity;
    }
}
