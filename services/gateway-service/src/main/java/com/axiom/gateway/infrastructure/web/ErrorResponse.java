package com.axiom.gateway.infrastructure.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Error envelope returned by every failing endpoint:
 *
 * <pre>
 * {"error": {"code": "RATE_LIMITED", "message": "rate limit exceeded",
 *            "retry_after_ms": 60000, "correlation_id": "..."}}
 * </pre>
 */
public record ErrorResponse(@JsonProperty("error") Body error) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Body(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("details") Map<String, Object> details,
            @JsonProperty("retry_after_ms") Long retryAfterMs,
            @JsonProperty("correlation_id") String correlationId) {
    }
}
