package fr.lapetina.dopc.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.dopc.api.dto.ErrorResponse;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for the JSON listeners, on the JDK's built-in HttpServer.
 *
 * Owns the listener and its fixed worker pool, and provides the response helpers
 * shared by the pricing and balancer endpoints.
 */
public abstract class JsonHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpServer.class);

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_REQUEST_ID = "requestId";

    protected final ObjectMapper objectMapper;
    protected final MetricsRegistry metricsRegistry;

    private final HttpServer server;
    private final ExecutorService executor;
    private final int stopDelaySeconds;
    private final String name;

    /**
     * Binds the listener. Fails if the address is unavailable.
     */
    protected JsonHttpServer(
            String name,
            String host,
            int port,
            DopcConfig.ServerConfig serverConfig,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.name = name;
        this.metricsRegistry = metricsRegistry;
        this.stopDelaySeconds = serverConfig.getStopDelaySeconds();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);

        this.server = HttpServer.create(new InetSocketAddress(host, port), serverConfig.getBacklog());

        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(serverConfig.getWorkerThreads(), r -> {
            Thread t = new Thread(r, name + "-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/metrics", this::handleMetrics);

        log.info("{} listener bound on {}:{}", name, host, getPort());
    }

    protected final void createContext(String path, com.sun.net.httpserver.HttpHandler handler) {
        server.createContext(path, handler);
    }

    public void start() {
        server.start();
        log.info("{} listener started on port {}", name, getPort());
    }

    /**
     * Actual bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(stopDelaySeconds);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("{} listener stopped", name);
    }

    // ==================== HELPER METHODS ====================

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }
        String metrics = metricsRegistry.scrape();
        byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /**
     * Uses the caller's X-Request-ID when present, otherwise a new UUID.
     */
    protected static String requestId(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
        return header != null && !header.isBlank() ? header : UUID.randomUUID().toString();
    }

    /**
     * Decodes a raw query string. The first occurrence of a repeated key wins;
     * a key without '=' maps to the empty string.
     */
    public static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            parameters.putIfAbsent(
                    URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return parameters;
    }

    protected void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        sendRawJson(exchange, statusCode, objectMapper.writeValueAsBytes(body));
    }

    protected void sendRawJson(HttpExchange exchange, int statusCode, byte[] bytes) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(statusCode, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    protected void sendError(HttpExchange exchange, ErrorType errorType, String message) throws IOException {
        sendJson(exchange, errorType.getHttpStatus(), ErrorResponse.of(errorType, message));
    }

    protected void sendMethodNotAllowed(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Allow", "GET");
        sendJson(exchange, 405, ErrorResponse.of(
                "Method " + exchange.getRequestMethod() + " not supported. Only GET requests are allowed."));
    }

    protected void sendNotFound(HttpExchange exchange) throws IOException {
        sendJson(exchange, 404, ErrorResponse.of("Not found: " + exchange.getRequestURI().getPath()));
    }
}
