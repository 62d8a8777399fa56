package com.axiom.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings shared by the dependency circuit breakers, bound from {@code axiom.circuit-breaker.*}.
 * Defaults: 5 failures to open, 2 successes to close, 30 seconds open.
 */
@ConfigurationProperties(prefix = "axiom.circuit-breaker")
public record CircuitBreakerProperties(int failureThreshold, int successThreshold, Duration timeout) {

    public CircuitBreakerProperties {
        if (failureThreshold <= 0) {
            failureThreshold = 5;
        }
        if (successThreshold <= 0) {
            successThreshold = 2;
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
    }
}
