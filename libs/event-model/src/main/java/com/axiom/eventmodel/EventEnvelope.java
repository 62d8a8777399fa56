package com.axiom.eventmodel;

import java.time.Instant;

/**
 * Canonical envelope for every domain event the gateway publishes.
 *
 * <p>The envelope carries identification, correlation and project scoping alongside the
 * event-specific payload. Publishing is fire-and-forget; consumers must tolerate loss.
 *
 * @param <T> the type of the domain-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** The type/name of this event (e.g. "CertificateIssued"). */
        String eventType,

        /** Schema version of this event type, starting at 1. */
        int eventVersion,

        /** When the event occurred. */
        Instant occurredAt,

        /** Name of the service that produced this event. */
        String producer,

        /** Project the event belongs to; null for platform-level events such as breaker transitions. */
        String projectId,

        /** Correlation ID linking the event to the request that caused it. */
        String correlationId,

        /** ID of the command or event that directly caused this event. */
        String causationId,

        /** The domain entity this event relates to. */
        EventEntity entity,

        /** Domain-specific event data. */
        T payload) {}
