package com.axiom.gateway.config;

import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Budget settings, bound from {@code axiom.budget.*}.
 *
 * @param defaultLimit limit for projects without their own, defaults to 10.00
 * @param failOpen admit cost-incurring work at the default limit when budgets cannot be read
 * @param generationEstimate cost reserved when admitting a generation
 * @param verificationEstimate cost reserved when admitting a verification run
 */
@ConfigurationProperties(prefix = "axiom.budget")
@Validated
public record BudgetProperties(
        @DecimalMin("0") BigDecimal defaultLimit,
        Boolean failOpen,
        @DecimalMin("0") BigDecimal generationEstimate,
        @DecimalMin("0") BigDecimal verificationEstimate) {

    public BudgetProperties {
        if (defaultLimit == null) {
            defaultLimit = new BigDecimal("10.00");
        }
        if (failOpen == null) {
            failOpen = Boolean.TRUE;
        }
        if (generationEstimate == null) {
            generationEstimate = new BigDecimal("0.05");
        }
        if (verificationEstimate == null) {
            verificationEstimate = new BigDecimal("0.01");
        }
    }
}
