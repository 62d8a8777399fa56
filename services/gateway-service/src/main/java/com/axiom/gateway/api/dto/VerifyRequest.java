package com.axiom.gateway.api.dto;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record VerifyRequest(@NotNull UUID ivcuId) {
}
