package com.warden.controlplane.api.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthResult;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/** Request and response messages of {@code warden.v1.HealthService}. */
public final class HealthMessages {

    private HealthMessages() {}

    public record CheckHealthRequest() {}

    /** @param serving {@code false} only when a critical component is unhealthy */
    public record CheckHealthResponse(
            @JsonProperty("status") String status,
            @JsonProperty("serving") boolean serving,
            @JsonProperty("checks") Map<String, ComponentStatus> checks,
            @JsonProperty("timestamp") Instant timestamp) {

        static CheckHealthResponse of(HealthResult result) {
            Map<String, ComponentStatus> checks = new TreeMap<>();
            result.checks().forEach((name, health) -> checks.put(name, ComponentStatus.of(health)));
            return new CheckHealthResponse(
                    result.status().name(), result.isServing(), checks, result.timestamp());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ComponentStatus(
            @JsonProperty("status") String status,
            @JsonProperty("message") String message,
            @JsonProperty("latency_ms") long latencyMs) {

        static ComponentStatus of(ComponentHealth health) {
            return new ComponentStatus(
                    health.status().name(), health.message(), health.latencyMs());
        }
    }
}
