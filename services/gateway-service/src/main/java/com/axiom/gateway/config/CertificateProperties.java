package com.axiom.gateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Certificate signing settings, bound from {@code axiom.certificate.*}.
 */
@ConfigurationProperties(prefix = "axiom.certificate")
@Validated
public record CertificateProperties(@NotBlank String signingSecret, String verifierVersion) {

    public CertificateProperties {
        if (verifierVersion == null || verifierVersion.isBlank()) {
            verifierVersion = "1.0.0";
        }
    }
}
