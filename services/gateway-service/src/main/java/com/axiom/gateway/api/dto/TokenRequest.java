package com.axiom.gateway.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/** Body of {@code POST /api/v1/auth/token}. */
public record TokenRequest(@NotNull UUID userId, @Email String email, String platformRole) {
}
