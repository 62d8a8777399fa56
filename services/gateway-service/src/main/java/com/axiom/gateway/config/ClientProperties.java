package com.axiom.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Collaborator endpoints, bound from {@code axiom.clients.*}.
 */
@ConfigurationProperties(prefix = "axiom.clients")
public record ClientProperties(Endpoint generation, Endpoint verification) {

    public ClientProperties {
        generation = Endpoint.withDefaults(generation, Duration.ofSeconds(120));
        verification = Endpoint.withDefaults(verification, Duration.ofSeconds(60));
    }

    public record Endpoint(String baseUrl, Duration connectTimeout, Duration readTimeout) {

        static Endpoint withDefaults(Endpoint endpoint, Duration readTimeout) {
            if (endpoint == null) {
                return new Endpoint("http://localhost:8000", Duration.ofSeconds(5), readTimeout);
            }
            return new Endpoint(
                    endpoint.baseUrl() != null ? endpoint.baseUrl() : "http://localhost:8000",
                    endpoint.connectTimeout() != null ? endpoint.connectTimeout() : Duration.ofSeconds(5),
                    endpoint.readTimeout() != null ? endpoint.readTimeout() : readTimeout);
        }
    }
}
