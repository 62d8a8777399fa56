package com.axiom.gateway.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.axiom.gateway.support.MutableClock;
import com.axiom.observability.ComponentHealth;
import com.axiom.observability.HealthStatus;
import com.axiom.resilience.CircuitBreaker;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CircuitBreakerHealthCheck")
class CircuitBreakerHealthCheckTest {

    private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    private final CircuitBreaker breaker = new CircuitBreaker("generation", 1, 1, Duration.ofSeconds(30), clock, null);
    private final CircuitBreakerHealthCheck check = new CircuitBreakerHealthCheck(breaker);

    @Test
    @DisplayName("is healthy while the circuit is closed")
    void closed() {
        ComponentHealth health = check.check().join();

        assertThat(health.name()).isEqualTo("generation");
        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("is degraded, not unhealthy, while the circuit is open")
    void open() {
        breaker.recordFailure();

        ComponentHealth health = check.check().join();

        assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(health.message()).isEqualTo("circuit open");
    }
}
