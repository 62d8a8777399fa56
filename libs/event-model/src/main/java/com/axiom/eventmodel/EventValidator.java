package com.axiom.eventmodel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks envelopes against their event type before publishing, collecting every problem
 * instead of stopping at the first.
 */
public final class EventValidator {

    /** Outcome of a validation; {@code errors} is empty when the envelope is publishable. */
    public record Result(List<String> errors) {

        public Result {
            errors = List.copyOf(errors);
        }

        public boolean valid() {
            return errors.isEmpty();
        }
    }

    private EventValidator() {
    }

    public static Result validate(EventEnvelope<?> event) {
        List<String> errors = new ArrayList<>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be blank");
        }
        Optional<EventType> type = Optional.ofNullable(event.eventType()).flatMap(EventType::fromString);
        if (type.isEmpty()) {
            errors.add("eventType '" + event.eventType() + "' is not a known event type");
        }
        if (event.eventVersion() < 1) {
            errors.add("eventVersion must be >= 1");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (isBlank(event.producer())) {
            errors.add("producer must not be blank");
        }
        if (isBlank(event.correlationId())) {
            errors.add("correlationId must not be blank");
        }
        type.ifPresent(t -> checkAgainstType(t, event, errors));
        checkEntity(event.entity(), errors);

        return new Result(errors);
    }

    private static void checkAgainstType(EventType type, EventEnvelope<?> event, List<String> errors) {
        if (type.projectScoped() && isBlank(event.projectId())) {
            errors.add(type.value() + " events must name a project");
        }
        if (!type.payloadType().isInstance(event.payload())) {
            errors.add(type.value() + " payload must be a " + type.payloadType().getSimpleName());
        }
    }

    private static void checkEntity(EventEntity entity, List<String> errors) {
        if (entity == null) {
            errors.add("entity must not be null");
            return;
        }
        if (EntityType.fromString(entity.entityType()).isEmpty()) {
            errors.add("entity type '" + entity.entityType() + "' is not known");
        }
        if (isBlank(entity.entityId())) {
            errors.add("entity id must not be blank");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
