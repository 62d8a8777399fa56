package com.axiom.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for {@link EventEnvelope}. Instants are written as ISO-8601 strings. Reading
 * resolves the payload record from the envelope's {@code eventType}, so consumers do not
 * need to know the type up front.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private EventSerializer() {
    }

    /**
     * @throws EventSerializationException if the payload cannot be written
     */
    public static String serialize(EventEnvelope<?> event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("failed to serialize event " + event.eventId(), e);
        }
    }

    /**
     * Reads an envelope whose payload type follows from its event type.
     *
     * @throws EventSerializationException if the JSON is malformed, names an unknown event type,
     *                                     or its payload does not match that type
     */
    public static EventEnvelope<?> deserialize(String json) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("malformed event json", e);
        }
        String typeName = tree.path("eventType").asText(null);
        EventType type = EventType.fromString(typeName)
                .orElseThrow(() -> new EventSerializationException("unknown event type '" + typeName + "'", null));
        JavaType envelopeType = MAPPER.getTypeFactory()
                .constructParametricType(EventEnvelope.class, type.payloadType());
        try {
            return MAPPER.treeToValue(tree, envelopeType);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("failed to read " + typeName + " event", e);
        }
    }

    /** Thrown when an envelope cannot be written or read. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
