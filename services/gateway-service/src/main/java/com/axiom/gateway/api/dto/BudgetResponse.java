package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.budget.BudgetSummary;
import java.math.BigDecimal;
import java.util.UUID;

public record BudgetResponse(UUID projectId, BigDecimal budgetLimit, BigDecimal currentUsage,
                             BigDecimal remaining, boolean defaultLimit) {

    public static BudgetResponse from(BudgetSummary summary) {
        return new BudgetResponse(summary.projectId(), summary.budgetLimit(), summary.currentUsage(),
                summary.remaining(), summary.defaultLimit());
    }
}
