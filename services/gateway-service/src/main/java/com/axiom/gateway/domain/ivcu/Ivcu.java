package com.axiom.gateway.domain.ivcu;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Intent-verified code unit: one versioned attempt at turning an intent into verified code.
 * Lineage is recorded through {@code parentIds}, oldest relationship first.
 */
public record Ivcu(
        UUID id,
        UUID projectId,
        int version,
        String rawIntent,
        String code,
        String language,
        IvcuStatus status,
        Double confidenceScore,
        String modelId,
        UUID createdBy,
        List<UUID> parentIds,
        Instant createdAt,
        Instant updatedAt) {

    public Ivcu {
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        if (confidenceScore != null && (confidenceScore < 0.0 || confidenceScore > 1.0)) {
            throw new IllegalArgumentException("confidenceScore must be within [0, 1]");
        }
        parentIds = parentIds == null ? List.of() : List.copyOf(parentIds);
    }

    /** New first-version draft with no lineage. */
    public static Ivcu draft(UUID id, UUID projectId, String rawIntent, String language, UUID createdBy,
                             Instant now) {
        return new Ivcu(id, projectId, 1, rawIntent, null, language, IvcuStatus.DRAFT, null, null,
                createdBy, List.of(), now, now);
    }

    Ivcu withStatus(IvcuStatus newStatus, Instant now) {
        return new Ivcu(id, projectId, version, rawIntent, code, language, newStatus, confidenceScore,
                modelId, createdBy, parentIds, createdAt, now);
    }

    /** Copy carrying generated code. */
    public Ivcu withCode(String newCode, String newModelId, Instant now) {
        return new Ivcu(id, projectId, version, rawIntent, newCode, language, status, confidenceScore,
                newModelId, createdBy, parentIds, createdAt, now);
    }

    Ivcu withConfidence(double confidence, Instant now) {
        return new Ivcu(id, projectId, version, rawIntent, code, language, status, confidence,
                modelId, createdBy, parentIds, createdAt, now);
    }
}
