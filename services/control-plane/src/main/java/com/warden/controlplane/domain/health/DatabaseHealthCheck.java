package com.warden.controlplane.domain.health;

import com.warden.database.Store;
import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthCheck;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/** Pings the control-plane database. */
public class DatabaseHealthCheck implements HealthCheck {

    public static final String NAME = "database";

    private final Store store;
    private final Executor executor;

    public DatabaseHealthCheck(Store store, Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(
                () -> {
                    long start = System.currentTimeMillis();
                    boolean reachable = store.ping();
                    long latency = System.currentTimeMillis() - start;
                    return reachable
                            ? ComponentHealth.healthy(NAME, latency)
                            : ComponentHealth.unhealthy(NAME, "ping failed", latency);
                },
                executor);
    }
}
