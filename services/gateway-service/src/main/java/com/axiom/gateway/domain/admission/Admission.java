package com.axiom.gateway.domain.admission;

import com.axiom.gateway.domain.budget.BudgetStatus;
import com.axiom.resilience.RateLimitDecision;
import com.axiom.security.AuthenticatedPrincipal;
import com.axiom.security.ProjectRole;
import java.util.UUID;

/**
 * A granted admission. Fields for gates that did not apply are null.
 */
public record Admission(
        AuthenticatedPrincipal principal,
        UUID projectId,
        ProjectRole projectRole,
        RateLimitDecision rateLimit,
        BudgetStatus budgetStatus) {
}
