package com.axiom.gateway.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * IVCU lifecycle settings, bound from {@code axiom.ivcu.*}.
 *
 * @param confidenceThreshold minimum confidence for VERIFIED, defaults to 0.8
 * @param defaultLanguage language used when a generation request names none
 */
@ConfigurationProperties(prefix = "axiom.ivcu")
@Validated
public record IvcuProperties(
        @DecimalMin("0.0") @DecimalMax("1.0") Double confidenceThreshold, String defaultLanguage) {

    public IvcuProperties {
        if (confidenceThreshold == null) {
            confidenceThreshold = 0.8;
        }
        if (defaultLanguage == null || defaultLanguage.isBlank()) {
            defaultLanguage = "python";
        }
    }
}
