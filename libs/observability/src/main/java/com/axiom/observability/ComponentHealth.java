package com.axiom.observability;

/**
 * Outcome of one {@link HealthCheck}. {@code message} is null for a healthy component and
 * says what is wrong otherwise.
 *
 * @param latencyMs how long the check took, or the timeout when it never answered
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (status != HealthStatus.HEALTHY && (message == null || message.isBlank())) {
            throw new IllegalArgumentException(status + " health for " + name + " must say why");
        }
        latencyMs = Math.max(0, latencyMs);
    }

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
