package com.axiom.gateway.support;

import com.axiom.eventmodel.EventEnvelope;
import com.axiom.eventmodel.EventType;
import com.axiom.gateway.domain.event.EventPublisher;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Keeps every published event for assertions. */
public final class RecordingEventPublisher implements EventPublisher {

    private final List<EventEnvelope<?>> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(EventEnvelope<?> event) {
        events.add(event);
    }

    public List<EventEnvelope<?>> events() {
        return List.copyOf(events);
    }

    public List<EventEnvelope<?>> ofType(EventType type) {
        return events.stream()
                .filter(e -> e.eventType().equals(type.value()))
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
