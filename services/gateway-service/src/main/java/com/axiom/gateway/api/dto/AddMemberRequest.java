package com.axiom.gateway.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/v1/projects/{projectId}/team}; {@code role} is viewer, editor or admin. */
public record AddMemberRequest(@NotBlank @Email String email, @NotBlank String role) {
}
