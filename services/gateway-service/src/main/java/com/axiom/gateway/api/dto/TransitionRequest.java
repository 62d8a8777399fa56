package com.axiom.gateway.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/v1/ivcus/{id}/transition}; {@code status} is the target label. */
public record TransitionRequest(@NotBlank String status) {
}
