package com.axiom.gateway.domain.budget;

import java.math.BigDecimal;
import java.util.UUID;

/** Budget view returned to project members with cost visibility. */
public record BudgetSummary(
        UUID projectId, BigDecimal budgetLimit, BigDecimal currentUsage, BigDecimal remaining,
        boolean defaultLimit) {
}
