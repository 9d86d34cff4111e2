package com.warden.observability;

import java.util.concurrent.CompletableFuture;

/**
 * A lightweight check of one dependency.
 * <p>
 * Example:
 * <pre>{@code
 * HealthCheck database = () -> CompletableFuture.supplyAsync(() -> {
 *     long start = System.currentTimeMillis();
 *     return store.ping()
 *             ? ComponentHealth.healthy("database", System.currentTimeMillis() - start)
 *             : ComponentHealth.unhealthy("database", "ping failed", System.currentTimeMillis() - start);
 * });
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
