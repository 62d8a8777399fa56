package com.axiom.gateway.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity and web settings, bound from {@code axiom.service.*}.
 *
 * <pre>
 * axiom:
 *   service:
 *     name: gateway-service
 *     environment: production
 *     allowed-origins:
 *       - https://app.example.com
 * </pre>
 *
 * @param name service name used for logging and metrics. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param description human-readable description for the info endpoint
 * @param allowedOrigins CORS origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "axiom.service")
@Validated
public record ServiceProperties(
        @NotBlank String name, String environment, String description, List<String> allowedOrigins) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
        }
    }
}
