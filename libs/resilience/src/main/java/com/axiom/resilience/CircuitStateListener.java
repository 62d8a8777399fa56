package com.axiom.resilience;

/**
 * Callback for circuit breaker state transitions. Invoked after the breaker's lock is released.
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(String breakerName, CircuitState from, CircuitState to);

    /** Listener that does nothing. */
    CircuitStateListener NONE = (name, from, to) -> { };
}
