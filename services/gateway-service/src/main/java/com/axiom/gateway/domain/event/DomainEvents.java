package com.axiom.gateway.domain.event;

import com.axiom.eventmodel.EventEntity;
import com.axiom.eventmodel.EventEnvelope;
import com.axiom.eventmodel.EventFactory;
import com.axiom.eventmodel.EventType;
import com.axiom.observability.CorrelationContext;
import com.axiom.observability.CorrelationContextHolder;
import java.time.Clock;
import java.util.UUID;

/**
 * Builds envelopes for events emitted by this service, joining the current request's
 * correlation flow when one is active.
 */
public final class DomainEvents {

    private DomainEvents() {
    }

    public static <T> EventEnvelope<T> of(EventType type, UUID projectId, EventEntity entity, T payload,
                                          Clock clock) {
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElseGet(() -> UUID.randomUUID().toString());
        return EventFactory.create(type, EventPublisher.PRODUCER,
                projectId != null ? projectId.toString() : null,
                correlationId, clock.instant(), entity, payload);
    }
}
