package com.axiom.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs gateway work inside OpenTelemetry spans tagged with the active {@link CorrelationContext}.
 * <p>
 * Only the OTel API is used here. Without an SDK installed the tracer is a no-op and the work
 * simply runs.
 */
public final class SpanHelper {

    /** Attribute naming the remote service of an outbound span. */
    public static final String PEER_SERVICE = "peer.service";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Runs {@code work} in an INTERNAL span carrying {@code attributes}. */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        return run(builder, work);
    }

    /**
     * Runs a call to {@code dependency} in a CLIENT span named {@code dependency.operation}.
     */
    public <T> T outbound(String dependency, String operation, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(dependency + "." + operation)
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(PEER_SERVICE, dependency);
        return run(builder, work);
    }

    private <T> T run(SpanBuilder builder, Supplier<T> work) {
        CorrelationContextHolder.get().ifPresent(ctx -> {
            builder.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.projectId() != null) {
                builder.setAttribute("project.id", ctx.projectId());
            }
            if (ctx.userId() != null) {
                builder.setAttribute("user.id", ctx.userId());
            }
        });

        Span span = builder.startSpan();
        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
