package com.axiom.gateway.infrastructure.health;

import com.axiom.observability.ComponentHealth;
import com.axiom.observability.HealthCheck;
import com.axiom.resilience.CircuitBreaker;
import com.axiom.resilience.CircuitState;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Reports a dependency as degraded while its breaker is not closed. The gateway keeps serving
 * other operations, so an open breaker never makes the service unhealthy.
 */
public class CircuitBreakerHealthCheck implements HealthCheck {

    private final CircuitBreaker breaker;

    public CircuitBreakerHealthCheck(CircuitBreaker breaker) {
        this.breaker = breaker;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        CircuitState state = breaker.state();
        ComponentHealth health = state == CircuitState.CLOSED
                ? ComponentHealth.healthy(breaker.name(), 0)
                : ComponentHealth.degraded(breaker.name(), "circuit " + state.name().toLowerCase(Locale.ROOT), 0);
        return CompletableFuture.completedFuture(health);
    }
}
