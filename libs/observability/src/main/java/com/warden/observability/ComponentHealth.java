package com.warden.observability;

/**
 * Health result for a single component.
 *
 * @param name      component name (e.g., "database", "events")
 * @param status    health status of this component
 * @param message   optional detail, set when the component is not healthy
 * @param latencyMs time taken by the check in milliseconds
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }

    /** Same result with the status capped at {@link HealthStatus#DEGRADED}. */
    ComponentHealth downgradedToDegraded() {
        return status == HealthStatus.UNHEALTHY
                ? new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs)
                : this;
    }
}
