package com.axiom.gateway.domain.ivcu;

import java.util.List;

/**
 * Result reported by one verifier.
 *
 * @param tier 0 (syntax) to 3 (formal); higher tiers weigh more in the aggregate confidence
 */
public record VerifierResult(String name, int tier, boolean passed, double confidence, List<String> messages) {

    public VerifierResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("verifier name must not be blank");
        }
        if (tier < 0 || tier > 3) {
            throw new IllegalArgumentException("tier must be within [0, 3]");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
