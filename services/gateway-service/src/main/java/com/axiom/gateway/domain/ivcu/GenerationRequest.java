package com.axiom.gateway.domain.ivcu;

import java.util.List;
import java.util.UUID;

/** What the code generation service is asked to produce. */
public record GenerationRequest(UUID ivcuId, UUID projectId, String intent, List<String> constraints,
                                String language) {

    public GenerationRequest {
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
