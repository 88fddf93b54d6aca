package fr.lapetina.dopc.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory venue API on an ephemeral port.
 *
 * Serves {@code /home-assignment-api/v1/venues/{slug}/static|dynamic}. Unknown venues
 * answer 404; {@link #failWith(int)} forces every response to the given status.
 */
public final class MockVenueApi implements AutoCloseable {

    public static final String API_PATH = "/home-assignment-api/v1";

    private final HttpServer server;
    private final Map<String, String> resources = new ConcurrentHashMap<>();
    private final AtomicInteger requestCount = new AtomicInteger(0);
    private volatile int forcedStatus;

    public MockVenueApi() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(API_PATH + "/venues/", this::handle);
    }

    public MockVenueApi start() {
        server.start();
        return this;
    }

    public MockVenueApi venue(String slug, String staticPayload, String dynamicPayload) {
        resources.put(slug + "/static", staticPayload);
        resources.put(slug + "/dynamic", dynamicPayload);
        return this;
    }

    public MockVenueApi failWith(int status) {
        this.forcedStatus = status;
        return this;
    }

    public String getBaseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + API_PATH;
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    private void handle(HttpExchange exchange) throws IOException {
        requestCount.incrementAndGet();
        try {
            String path = exchange.getRequestURI().getPath();
            String key = path.substring((API_PATH + "/venues/").length());
            String body = resources.get(key);

            int status = forcedStatus != 0 ? forcedStatus : (body != null ? 200 : 404);
            byte[] bytes = (status == 200 ? body : "{\"error\": \"unavailable\"}").getBytes(StandardCharsets.UTF_8);

            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } finally {
            exchange.close();
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
