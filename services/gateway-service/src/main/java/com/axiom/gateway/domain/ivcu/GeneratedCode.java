package com.axiom.gateway.domain.ivcu;

import java.math.BigDecimal;

/** Code returned by the generation service, with the cost it incurred. */
public record GeneratedCode(String code, BigDecimal cost, String modelId) {
}
