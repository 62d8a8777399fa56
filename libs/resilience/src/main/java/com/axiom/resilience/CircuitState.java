package com.axiom.resilience;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    /** Normal operation; calls pass. */
    CLOSED,
    /** Dependency considered down; calls are rejected until the timeout elapses. */
    OPEN,
    /** Probing recovery with a single trial call at a time. */
    HALF_OPEN
}
