package com.axiom.gateway.domain.admission;

/** Admission gates, in the order they run. */
public enum Gate {
    AUTHENTICATE("authenticate"),
    AUTHORIZE("authorize"),
    RATE_LIMIT("rate_limit"),
    CIRCUIT_BREAKER("circuit_breaker"),
    BUDGET("budget");

    private final String value;

    Gate(String value) {
        this.value = value;
    }

    /** Metric tag and event label. */
    public String value() {
        return value;
    }
}
