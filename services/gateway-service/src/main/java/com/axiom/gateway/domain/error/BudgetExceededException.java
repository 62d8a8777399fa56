package com.axiom.gateway.domain.error;

import java.math.BigDecimal;
import java.util.Map;

/** The project's remaining budget does not cover the estimated cost. */
public class BudgetExceededException extends AdmissionDeniedException {

    private final BigDecimal remaining;

    public BudgetExceededException(BigDecimal remaining, BigDecimal estimatedCost) {
        super(ErrorCode.BUDGET_EXCEEDED, "insufficient budget", null,
                Map.of("remaining_budget", remaining, "estimated_cost", estimatedCost));
        this.remaining = remaining;
    }

    public BigDecimal remaining() {
        return remaining;
    }
}
