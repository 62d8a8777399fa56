package com.axiom.gateway.domain.budget;

import java.math.BigDecimal;

/** Outcome of a budget check. {@code remaining} may be negative for overdrawn projects. */
public record BudgetStatus(boolean allowed, BigDecimal remaining, String reason) {

    public static final String SUFFICIENT = "budget sufficient";
    public static final String INSUFFICIENT = "insufficient budget";
}
