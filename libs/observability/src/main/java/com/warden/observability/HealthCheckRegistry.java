package com.warden.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs registered {@link HealthCheck}s concurrently and folds them into one
 * {@link HealthResult}.
 * <p>
 * A failing critical check makes the process {@link HealthStatus#UNHEALTHY};
 * a failing non-critical check only makes it {@link HealthStatus#DEGRADED}.
 * Checks that throw, fail, or exceed the timeout count as failing.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private record Registration(HealthCheck check, boolean critical) {
    }

    private final Map<String, Registration> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;
    private final Clock clock;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS, Clock.systemUTC());
    }

    /**
     * @param timeoutMs timeout in milliseconds for each individual check
     * @param clock     clock used to stamp results
     */
    public HealthCheckRegistry(long timeoutMs, Clock clock) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    /** Registers a critical check, replacing any check with the same name. */
    public void register(String name, HealthCheck check) {
        register(name, check, true);
    }

    /**
     * Registers a check under {@code name}, replacing any check with the same name.
     *
     * @param critical whether a failure of this check makes the process unhealthy
     */
    public void register(String name, HealthCheck check, boolean critical) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, new Registration(check, critical));
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs every check and aggregates the results. With no checks registered
     * the result is {@link HealthStatus#HEALTHY}.
     */
    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        checks.forEach((name, registration) -> futures.put(name, start(name, registration.check())));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                log.warn("Health check {} failed", name, e);
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeoutMs);
            }
            Registration registration = checks.get(name);
            if (registration != null && !registration.critical()) {
                result = result.downgradedToDegraded();
            }
            results.put(name, result);
        }
        return HealthResult.of(results, clock.instant());
    }

    public int size() {
        return checks.size();
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            CompletableFuture<ComponentHealth> future = check.check();
            if (future == null) {
                return CompletableFuture.completedFuture(
                        ComponentHealth.unhealthy(name, "health check returned no result", 0));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
