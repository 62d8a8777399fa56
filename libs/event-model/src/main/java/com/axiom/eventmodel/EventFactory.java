package com.axiom.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds version 1 envelopes with generated event ids.
 */
public final class EventFactory {

    /** Causation id of events triggered by a request rather than by another event. */
    public static final String DIRECT_CAUSATION = "direct";

    private EventFactory() {
    }

    /**
     * Creates an envelope inside an existing correlation flow.
     *
     * @param projectId owning project, null for platform-level events
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String projectId,
            String correlationId,
            Instant occurredAt,
            EventEntity entity,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                projectId,
                correlationId,
                DIRECT_CAUSATION,
                entity,
                payload
        );
    }
}
