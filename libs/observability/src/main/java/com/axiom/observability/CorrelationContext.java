package com.axiom.observability;

/**
 * Immutable correlation context that flows with a request through the gateway.
 * <p>
 * Every inbound request establishes a {@code CorrelationContext}. Once the caller is
 * authenticated and the target project is known, the admission pipeline enriches the context
 * with the user and project identifiers so that every later log line and span carries them.
 *
 * @param correlationId unique ID for the business flow (intent → generation → verification → certificate)
 * @param projectId     project the request operates on (nullable until resolved)
 * @param userId        authenticated principal (nullable for public or unauthenticated calls)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String projectId,
        String userId,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for project ID. */
    public static final String MDC_PROJECT_ID = "projectId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    /**
     * Rejects a null or blank correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    /** Returns a copy with the given user ID. */
    public CorrelationContext withUserId(String newUserId) {
        return new CorrelationContext(correlationId, projectId, newUserId, requestId, spanId, traceId);
    }

    /** Returns a copy with the given project ID. */
    public CorrelationContext withProjectId(String newProjectId) {
        return new CorrelationContext(correlationId, newProjectId, userId, requestId, spanId, traceId);
    }
}
