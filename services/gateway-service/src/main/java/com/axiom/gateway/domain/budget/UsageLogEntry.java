package com.axiom.gateway.domain.budget;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** One row of the usage audit trail. */
public record UsageLogEntry(
        UUID id,
        UUID projectId,
        UUID userId,
        BigDecimal cost,
        String operationType,
        UsageDetails details,
        Instant createdAt) {
}
