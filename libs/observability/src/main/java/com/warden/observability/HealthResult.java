package com.warden.observability;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of all registered health checks.
 *
 * @param status    overall status, the worst of the component results
 * @param checks    component results keyed by component name
 * @param timestamp when the checks completed
 */
public record HealthResult(
        HealthStatus status,
        Map<String, ComponentHealth> checks,
        Instant timestamp
) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }

    /** Aggregates component results; no components means {@link HealthStatus#HEALTHY}. */
    public static HealthResult of(Map<String, ComponentHealth> checks, Instant timestamp) {
        HealthStatus overall = HealthStatus.HEALTHY;
        for (ComponentHealth component : checks.values()) {
            overall = overall.worst(component.status());
        }
        return new HealthResult(overall, checks, timestamp);
    }

    /** A degraded component still serves; an unhealthy one does not. */
    public boolean isServing() {
        return status != HealthStatus.UNHEALTHY;
    }

    /** Names of the components reporting {@link HealthStatus#UNHEALTHY}, sorted. */
    public List<String> failing() {
        return checks.entrySet().stream()
                .filter(entry -> entry.getValue().status() == HealthStatus.UNHEALTHY)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
