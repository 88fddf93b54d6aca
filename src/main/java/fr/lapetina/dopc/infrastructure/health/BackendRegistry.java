package fr.lapetina.dopc.infrastructure.health;

import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.InstanceHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Registry of the balancer's backend instances and of their healthy subset.
 *
 * Selection is round-robin over the healthy subset only. The cursor is taken modulo
 * the current subset size on every call, so a membership change may shift the
 * rotation by one position. Cursor and healthy-set updates share one lock.
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final List<BackendInstance> backends = new ArrayList<>();
    private final List<BackendInstance> healthy = new ArrayList<>();
    private int cursor;

    /**
     * Registers a backend. It stays registered until {@link #clear()}.
     */
    public synchronized void register(BackendInstance backend) {
        if (backends.contains(backend)) {
            throw new IllegalArgumentException("Backend already registered: " + backend.getId());
        }
        backends.add(backend);
        log.info("Backend registered: {}", backend);
    }

    /**
     * Marks a backend healthy and appends it to the healthy set if absent.
     *
     * @return true if the healthy set changed
     */
    public synchronized boolean markHealthy(BackendInstance backend) {
        InstanceHealth previous = backend.setHealth(InstanceHealth.HEALTHY);
        boolean added = false;
        if (!healthy.contains(backend)) {
            healthy.add(backend);
            added = true;
        }
        if (previous != InstanceHealth.HEALTHY) {
            log.info("Backend health changed: backendId={}, {} -> {}, healthyCount={}",
                    backend.getId(), previous, InstanceHealth.HEALTHY, healthy.size());
        }
        return added;
    }

    /**
     * Marks a backend unhealthy and removes it from the healthy set if present.
     *
     * @return true if the healthy set changed
     */
    public synchronized boolean markUnhealthy(BackendInstance backend) {
        InstanceHealth previous = backend.setHealth(InstanceHealth.UNHEALTHY);
        boolean removed = healthy.remove(backend);
        if (previous != InstanceHealth.UNHEALTHY) {
            log.warn("Backend health changed: backendId={}, {} -> {}, healthyCount={}",
                    backend.getId(), previous, InstanceHealth.UNHEALTHY, healthy.size());
        }
        return removed;
    }

    /**
     * Picks the next healthy backend, round-robin.
     *
     * @return the backend, or empty if no backend is healthy
     */
    public synchronized Optional<BackendInstance> selectNext() {
        if (healthy.isEmpty()) {
            return Optional.empty();
        }
        int index = cursor % healthy.size();
        BackendInstance selected = healthy.get(index);
        cursor = (index + 1) % healthy.size();
        return Optional.of(selected);
    }

    public synchronized List<BackendInstance> getAllBackends() {
        return List.copyOf(backends);
    }

    /**
     * Healthy backends in insertion order.
     */
    public synchronized List<BackendInstance> getHealthyBackends() {
        return List.copyOf(healthy);
    }

    public synchronized Optional<BackendInstance> getBackend(String backendId) {
        return backends.stream()
                .filter(b -> b.getId().equals(backendId))
                .findFirst();
    }

    public synchronized int size() {
        return backends.size();
    }

    public synchronized int healthyCount() {
        return healthy.size();
    }

    /**
     * Drops every backend, healthy or not, and resets the rotation.
     */
    public synchronized void clear() {
        backends.clear();
        healthy.clear();
        cursor = 0;
    }
}
