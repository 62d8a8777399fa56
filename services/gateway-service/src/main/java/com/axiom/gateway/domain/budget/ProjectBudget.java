package com.axiom.gateway.domain.budget;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stored budget row of a project. {@code budgetLimit} is null when the project uses the
 * configured default.
 */
public record ProjectBudget(UUID projectId, BigDecimal budgetLimit, BigDecimal currentUsage) {

    public BigDecimal effectiveLimit(BigDecimal defaultLimit) {
        return budgetLimit != null ? budgetLimit : defaultLimit;
    }
}
