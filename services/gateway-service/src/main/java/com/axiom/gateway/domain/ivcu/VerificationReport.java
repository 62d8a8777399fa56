package com.axiom.gateway.domain.ivcu;

import java.math.BigDecimal;
import java.util.List;

/** Per-verifier results from one verification run and what the run cost. */
public record VerificationReport(List<VerifierResult> results, BigDecimal cost) {

    public VerificationReport {
        results = results == null ? List.of() : List.copyOf(results);
        cost = cost != null ? cost : BigDecimal.ZERO;
    }
}
