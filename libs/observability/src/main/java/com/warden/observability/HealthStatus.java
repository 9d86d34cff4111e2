package com.warden.observability;

/**
 * Health of one component or of the whole process.
 */
public enum HealthStatus {

    HEALTHY,

    /** A non-critical component is failing; requests are still served. */
    DEGRADED,

    /** A critical component is failing. */
    UNHEALTHY;

    /** Returns the worse of the two statuses. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
