package com.axiom.eventmodel.payload;

/** Payload of {@code CircuitStateChanged}. */
public record CircuitStateChangedPayload(String dependency, String fromState, String toState) {
}
