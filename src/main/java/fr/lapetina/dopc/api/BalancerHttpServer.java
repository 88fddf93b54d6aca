package fr.lapetina.dopc.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.dopc.LoadBalancer;
import fr.lapetina.dopc.disruptor.exception.BackpressureException;
import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client-facing listener of the load balancer.
 *
 * Endpoints:
 * - GET {endpoint} - Relayed to the next healthy backend
 * - GET /health - Balancer status with per-backend health
 * - GET /metrics - Prometheus metrics of the balancer
 */
public final class BalancerHttpServer extends JsonHttpServer {

    private static final Logger log = LoggerFactory.getLogger(BalancerHttpServer.class);

    // Extra wait on top of the forward timeout before giving up on the pipeline
    private static final long RESPONSE_GRACE_MS = 1_000;

    private final LoadBalancer loadBalancer;
    private final String endpoint;

    public BalancerHttpServer(DopcConfig config, LoadBalancer loadBalancer) throws IOException {
        this(config.getGeneral().getHost(), config.getGeneral().getPort(), config, loadBalancer);
    }

    public BalancerHttpServer(String host, int port, DopcConfig config, LoadBalancer loadBalancer) throws IOException {
        super("balancer", host, port, config.getServer(), loadBalancer.getMetricsRegistry());
        this.loadBalancer = loadBalancer;
        this.endpoint = config.getGeneral().getEndpoint();

        createContext(endpoint, new ForwardHandler());
        createContext("/health", new HealthHandler());
    }

    // ==================== FORWARD HANDLER ====================

    private class ForwardHandler implements HttpHandler {
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

                ForwardRequest request = ForwardRequest.of(requestId, exchange.getRequestURI().getRawQuery());

                ForwardResponse response;
                try {
                    response = loadBalancer.forward(request)
                            .get(loadBalancer.getForwardTimeoutMs() + RESPONSE_GRACE_MS, TimeUnit.MILLISECONDS);
                } catch (BackpressureException e) {
                    log.warn("Backpressure: {}", e.getMessage());
                    sendError(exchange, ErrorType.BACKPRESSURE, e.getMessage());
                    return;
                } catch (TimeoutException e) {
                    sendError(exchange, ErrorType.BALANCER_ERROR, "Load balancer error: no response from pipeline");
                    return;
                }

                if (response.isRelayed()) {
                    byte[] body = response.body() != null
                            ? response.body().getBytes(StandardCharsets.UTF_8)
                            : new byte[0];
                    sendRawJson(exchange, response.statusCode(), body);
                } else {
                    sendError(exchange, response.errorType(), response.errorMessage());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, ErrorType.INTERNAL_ERROR, "Interrupted while forwarding");
            } catch (Exception e) {
                log.error("Error forwarding request", e);
                sendError(exchange, ErrorType.BALANCER_ERROR, "Load balancer error: " + e.getMessage());
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

            List<BackendInstance> all = loadBalancer.getRegistry().getAllBackends();
            int healthyCount = loadBalancer.getRegistry().healthyCount();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", overallStatus(healthyCount, all.size()));
            health.put("healthy_backends", healthyCount);

            List<Map<String, Object>> backends = new ArrayList<>();
            for (BackendInstance backend : all) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", backend.getId());
                info.put("port", backend.getPort());
                info.put("health", backend.getHealth().name());
                info.put("last_checked", backend.getLastChecked());
                backends.add(info);
            }
            health.put("backends", backends);

            sendJson(exchange, healthyCount > 0 ? 200 : 503, health);
        }

        private String overallStatus(int healthyCount, int total) {
            if (healthyCount == 0) {
                return "unhealthy";
            }
            return healthyCount < total ? "degraded" : "healthy";
        }
    }
}
