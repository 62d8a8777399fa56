package com.axiom.gateway.infrastructure.event;

import com.axiom.eventmodel.EventEnvelope;
import com.axiom.eventmodel.EventSerializer;
import com.axiom.eventmodel.EventValidator;
import com.axiom.gateway.domain.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes events to the log as serialized envelopes. Invalid envelopes and serialization
 * failures are logged and dropped; publishing never fails the caller.
 */
@Component
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventPublisher.class);

    @Override
    public void publish(EventEnvelope<?> event) {
        EventValidator.Result validation = EventValidator.validate(event);
        if (!validation.valid()) {
            log.error("Dropping invalid {} event: {}", event.eventType(), validation.errors());
            return;
        }
        try {
            log.info("Event {} {}", event.eventType(), EventSerializer.serialize(event));
        } catch (EventSerializer.EventSerializationException e) {
            log.error("Failed to serialize {} event {}", event.eventType(), event.eventId(), e);
        }
    }
}
