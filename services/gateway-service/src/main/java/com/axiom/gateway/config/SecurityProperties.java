package com.axiom.gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer token settings, bound from {@code axiom.security.*}.
 *
 * @param jwtSecret HS256 shared secret, at least 32 bytes
 * @param tokenLifetime lifetime of issued tokens, defaults to 24 hours
 * @param devTokenEndpoint exposes {@code POST /api/v1/auth/token}; never enable in production
 */
@ConfigurationProperties(prefix = "axiom.security")
@Validated
public record SecurityProperties(
        @NotBlank @Size(min = 32) String jwtSecret, Duration tokenLifetime, boolean devTokenEndpoint) {

    public SecurityProperties {
        if (tokenLifetime == null || tokenLifetime.isZero() || tokenLifetime.isNegative()) {
            tokenLifetime = Duration.ofHours(24);
        }
    }
}
