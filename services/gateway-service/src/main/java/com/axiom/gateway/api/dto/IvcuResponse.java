package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.ivcu.Ivcu;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record IvcuResponse(
        UUID id,
        UUID projectId,
        int version,
        String rawIntent,
        String code,
        String language,
        String status,
        Double confidenceScore,
        String modelId,
        UUID createdBy,
        List<UUID> parentIds,
        Instant createdAt,
        Instant updatedAt) {

    public static IvcuResponse from(Ivcu ivcu) {
        return new IvcuResponse(ivcu.id(), ivcu.projectId(), ivcu.version(), ivcu.rawIntent(), ivcu.code(),
                ivcu.language(), ivcu.status().value(), ivcu.confidenceScore(), ivcu.modelId(), ivcu.createdBy(),
                ivcu.parentIds(), ivcu.createdAt(), ivcu.updatedAt());
    }
}
