package com.axiom.gateway.domain.budget;

import java.util.UUID;

/**
 * Structured context stored with a usage audit entry. All fields are optional.
 *
 * @param ivcuId IVCU the cost was incurred for
 * @param modelId model reported by the generation service
 * @param language target language of the operation
 * @param outcome short result label, e.g. {@code completed} or {@code verified}
 */
public record UsageDetails(UUID ivcuId, String modelId, String language, String outcome) {

    public static UsageDetails empty() {
        return new UsageDetails(null, null, null, null);
    }

    public static UsageDetails forIvcu(UUID ivcuId, String modelId, String language, String outcome) {
        return new UsageDetails(ivcuId, modelId, language, outcome);
    }
}
