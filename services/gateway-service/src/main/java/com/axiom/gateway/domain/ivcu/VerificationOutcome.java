package com.axiom.gateway.domain.ivcu;

import java.util.List;

/**
 * Aggregate of all verifier results for one verification run.
 */
public record VerificationOutcome(boolean passed, double confidence, List<VerifierResult> results) {

    private static final double[] TIER_WEIGHTS = {0.5, 1.0, 1.5, 2.0};

    public VerificationOutcome {
        results = List.copyOf(results);
    }

    /**
     * Combines verifier results into one outcome.
     *
     * <p>Confidence is the mean of per-verifier confidences weighted by tier. The run passes
     * only if every tier 0 result passed, at least one tier 1 result exists and all of them
     * passed, and every tier 2 and tier 3 result that is present passed. No results means a
     * failed run with zero confidence.
     */
    public static VerificationOutcome aggregate(List<VerifierResult> results) {
        if (results == null || results.isEmpty()) {
            return new VerificationOutcome(false, 0.0, List.of());
        }

        double weighted = 0.0;
        double totalWeight = 0.0;
        boolean tierOneSeen = false;
        boolean passed = true;
        for (VerifierResult result : results) {
            double weight = TIER_WEIGHTS[result.tier()];
            weighted += weight * result.confidence();
            totalWeight += weight;
            if (result.tier() == 1) {
                tierOneSeen = true;
            }
            if (!result.passed()) {
                passed = false;
            }
        }
        double confidence = Math.min(1.0, Math.max(0.0, weighted / totalWeight));
        return new VerificationOutcome(passed && tierOneSeen, confidence, results);
    }
}
