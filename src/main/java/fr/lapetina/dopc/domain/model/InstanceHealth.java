package fr.lapetina.dopc.domain.model;

/**
 * Health status of a backend pricing instance as seen by the balancer.
 *
 * STARTING: launched, not yet admitted to routing
 * HEALTHY: passed its last probe (or optimistically admitted at start)
 * UNHEALTHY: failed its last probe, excluded from routing
 */
public enum InstanceHealth {
    STARTING,
    HEALTHY,
    UNHEALTHY
}
