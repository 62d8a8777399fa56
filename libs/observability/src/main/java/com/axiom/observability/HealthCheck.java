package com.axiom.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for a single health check component.
 * <p>
 * Implementations probe one dependency (the relational store, a circuit-protected
 * downstream service) and return the result asynchronously. {@link HealthCheckRegistry}
 * runs all registered checks concurrently.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthCheck breakerCheck = () -> CompletableFuture.completedFuture(
 *         breaker.state() == CircuitState.CLOSED
 *                 ? ComponentHealth.healthy("generation", 0)
 *                 : ComponentHealth.degraded("generation", "circuit " + breaker.state(), 0));
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs a health check and returns the result asynchronously.
     *
     * @return a future that completes with the component health result
     */
    CompletableFuture<ComponentHealth> check();
}
