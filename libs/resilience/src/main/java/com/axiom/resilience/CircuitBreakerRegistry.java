package com.axiom.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds one {@link CircuitBreaker} per downstream dependency, all sharing the same settings
 * and state listener. Breakers are created eagerly for the given names.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();

    public CircuitBreakerRegistry(Collection<String> names, int failureThreshold, int successThreshold,
                                  Duration timeout, Clock clock, CircuitStateListener listener) {
        for (String name : names) {
            breakers.put(name, new CircuitBreaker(name, failureThreshold, successThreshold, timeout, clock, listener));
        }
    }

    /**
     * Returns the breaker for the dependency.
     *
     * @throws IllegalArgumentException if no breaker was registered under that name
     */
    public CircuitBreaker get(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw new IllegalArgumentException("No circuit breaker registered for '" + name + "'");
        }
        return breaker;
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Map<String, CircuitBreaker> all() {
        return Collections.unmodifiableMap(breakers);
    }
}
