package com.axiom.gateway.domain.event;

import com.axiom.eventmodel.EventEnvelope;

/**
 * Port for outbound domain events. Publishing is fire-and-forget: implementations must not
 * throw back into the caller's flow.
 */
public interface EventPublisher {

    /** Producer name stamped on every event this service emits. */
    String PRODUCER = "gateway-service";

    void publish(EventEnvelope<?> event);
}
