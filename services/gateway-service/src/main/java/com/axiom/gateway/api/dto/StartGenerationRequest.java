package com.axiom.gateway.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

/**
 * Body of {@code POST /api/v1/generation/start}.
 *
 * @param language target language; the configured default applies when absent
 */
public record StartGenerationRequest(
        @NotNull UUID projectId,
        @NotBlank @Size(max = 10_000) String intent,
        List<@NotBlank String> constraints,
        String language) {
}
