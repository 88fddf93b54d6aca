package fr.lapetina.dopc.domain.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A pricing service instance behind the load balancer.
 * Identity is the port; health and last-checked time are updated by the health checker.
 */
public final class BackendInstance {
    private final String id;
    private final String host;
    private final int port;

    // Mutable state - thread-safe
    private final AtomicReference<InstanceHealth> health = new AtomicReference<>(InstanceHealth.STARTING);
    private volatile Instant lastChecked;

    public BackendInstance(String host, int port) {
        this.host = Objects.requireNonNull(host, "Host is required");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.port = port;
        this.id = "backend-" + port;
    }

    public String getId() {
        return id;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public URI getBaseUrl() {
        return URI.create("http://" + host + ":" + port);
    }

    public InstanceHealth getHealth() {
        return health.get();
    }

    /**
     * Sets the health and returns the previous value.
     */
    public InstanceHealth setHealth(InstanceHealth newHealth) {
        return health.getAndSet(newHealth);
    }

    public Instant getLastChecked() {
        return lastChecked;
    }

    public void markChecked(Instant when) {
        this.lastChecked = when;
    }

    public boolean isHealthy() {
        return health.get() == InstanceHealth.HEALTHY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BackendInstance that = (BackendInstance) o;
        return port == that.port && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return "BackendInstance{" +
                "id='" + id + '\'' +
                ", baseUrl=" + getBaseUrl() +
                ", health=" + health.get() +
                '}';
    }
}
