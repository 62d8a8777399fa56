package com.axiom.eventmodel.payload;

/**
 * Payload of {@code AdmissionDenied}.
 *
 * @param operation gated operation name
 * @param gate      the gate that denied (authenticate, authorize, rate_limit, circuit_breaker, budget)
 * @param code      error envelope code returned to the caller
 * @param subject   principal id or client address the decision was keyed on
 */
public record AdmissionDeniedPayload(String operation, String gate, String code, String subject) {
}
