package fr.lapetina.dopc.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.dopc.domain.model.DeliveryPriceResponse;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.Outcome;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dopc.service.OrderPriceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Listener of one pricing instance.
 *
 * Endpoints:
 * - GET {endpoint} - Price a delivery order
 * - GET /health - Liveness, in-flight count and capacity
 * - GET /metrics - Prometheus metrics
 */
public final class PricingHttpServer extends JsonHttpServer {

    private static final Logger log = LoggerFactory.getLogger(PricingHttpServer.class);

    private final OrderPriceService service;
    private final String endpoint;

    public PricingHttpServer(
            String host,
            int port,
            String endpoint,
            DopcConfig.ServerConfig serverConfig,
            OrderPriceService service,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        super("pricing", host, port, serverConfig, metricsRegistry);
        this.service = service;
        this.endpoint = endpoint;

        createContext(endpoint, new PricingHandler());
        createContext("/health", new HealthHandler());
    }

    // ==================== PRICING HANDLER ====================

    private class PricingHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = requestId(exchange);
            MDC.put(MDC_REQUEST_ID, requestId);
            exchange.getResponseHeaders().set(REQUEST_ID_HEADER, requestId);

            try {
                if (!endpoint.equals(exchange.getRequestURI().getPath())) {
                    sendNotFound(exchange);
                    return;
                }
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendMethodNotAllowed(exchange);
                    return;
                }

                Map<String, String> parameters = parseQuery(exchange.getRequestURI().getRawQuery());
                log.debug("Received pricing request: params={}", parameters);

                Outcome<DeliveryPriceResponse> outcome = service.handle(parameters);
                if (outcome.isSuccess()) {
                    sendJson(exchange, 200, outcome.value());
                } else {
                    sendError(exchange, outcome.errorType(), outcome.errorMessage());
                }
            } catch (Exception e) {
                log.error("Error handling pricing request", e);
                sendError(exchange, ErrorType.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendMethodNotAllowed(exchange);
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "healthy");
            health.put("in_flight", service.getInFlight());
            health.put("capacity", service.getCapacity());
            sendJson(exchange, 200, health);
        }
    }
}
