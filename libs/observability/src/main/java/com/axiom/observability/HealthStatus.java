package com.axiom.observability;

/**
 * Health of a component or of the whole gateway, ordered from best to worst.
 */
public enum HealthStatus {

    HEALTHY,

    /** Impaired, e.g. a dependency breaker is open, but requests are still served. */
    DEGRADED,

    /** The gateway cannot serve requests, e.g. the database is unreachable. */
    UNHEALTHY;

    /** The worse of this status and {@code other}. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    /** Caps this status at DEGRADED, used for components the gateway can run without. */
    public HealthStatus atMostDegraded() {
        return this == UNHEALTHY ? DEGRADED : this;
    }
}
