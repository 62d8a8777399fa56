package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.budget.UsageDetails;
import com.axiom.gateway.domain.budget.UsageLogEntry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record UsageLogResponse(UUID id, UUID userId, BigDecimal cost, String operationType,
                               UsageDetails details, Instant createdAt) {

    public static UsageLogResponse from(UsageLogEntry entry) {
        return new UsageLogResponse(entry.id(), entry.userId(), entry.cost(), entry.operationType(),
                entry.details(), entry.createdAt());
    }
}
