package com.axiom.observability;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Per-thread {@link CorrelationContext}, mirrored into the SLF4J MDC.
 * <p>
 * A request thread enters a context with {@link #open(CorrelationContext)} and leaves it by
 * closing the returned {@link Scope}, which puts back whatever was active before. Every MDC key
 * tracks the active context: a field that is null has its key removed rather than left stale.
 * Work handed to another thread does not inherit the context.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private static final Map<String, Function<CorrelationContext, String>> MDC_FIELDS = new LinkedHashMap<>();

    static {
        MDC_FIELDS.put(CorrelationContext.MDC_CORRELATION_ID, CorrelationContext::correlationId);
        MDC_FIELDS.put(CorrelationContext.MDC_PROJECT_ID, CorrelationContext::projectId);
        MDC_FIELDS.put(CorrelationContext.MDC_USER_ID, CorrelationContext::userId);
        MDC_FIELDS.put(CorrelationContext.MDC_REQUEST_ID, CorrelationContext::requestId);
        MDC_FIELDS.put(CorrelationContext.MDC_SPAN_ID, CorrelationContext::spanId);
        MDC_FIELDS.put(CorrelationContext.MDC_TRACE_ID, CorrelationContext::traceId);
    }

    private CorrelationContextHolder() {
    }

    /**
     * Makes {@code context} the active one for this thread until the scope is closed.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static Scope open(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        Scope scope = new Scope(CONTEXT.get());
        activate(context);
        return scope;
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the active context with {@code update} applied to it. Does nothing outside a
     * scope, e.g. when a domain service runs from a test or a background task.
     */
    public static void update(UnaryOperator<CorrelationContext> update) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            activate(update.apply(current));
        }
    }

    /** Drops any active context and its MDC keys. */
    public static void clear() {
        CONTEXT.remove();
        MDC_FIELDS.keySet().forEach(MDC::remove);
    }

    private static void activate(CorrelationContext context) {
        CONTEXT.set(context);
        MDC_FIELDS.forEach((key, field) -> {
            String value = field.apply(context);
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        });
    }

    /** Restores the context that was active when the scope was opened. */
    public static final class Scope implements AutoCloseable {

        private final CorrelationContext previous;

        private Scope(CorrelationContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous != null) {
                activate(previous);
            } else {
                clear();
            }
        }
    }
}
