package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.gateway.domain.ivcu.GenerationCallback;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Status update posted by the workflow engine when a generation finishes.
 *
 * @param status {@code completed} or {@code failed}
 */
public record GenerationCallbackRequest(
        @NotBlank String status,
        String code,
        @DecimalMin("0") BigDecimal cost,
        String modelId,
        String error) {

    public GenerationCallback toCallback() {
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "completed" -> GenerationCallback.completed(code, cost, modelId);
            case "failed" -> GenerationCallback.failed(error);
            default -> throw new ValidationException("unknown callback status",
                    Map.of("status", status));
        };
    }
}
