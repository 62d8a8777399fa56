package com.axiom.eventmodel;

import com.axiom.eventmodel.payload.CircuitStateChangedPayload;
import com.axiom.eventmodel.payload.UsageRecordedPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventSerializer")
class EventSerializerTest {

    private EventEnvelope<UsageRecordedPayload> usageEvent() {
        return EventFactory.create(EventType.USAGE_RECORDED, "gateway-service", "project-1", "corr-1",
                Instant.parse("2026-02-01T10:00:00Z"),
                EventEntity.of(EntityType.PROJECT, "project-1", 0),
                new UsageRecordedPayload("user-1", new BigDecimal("0.2500"), "generation"));
    }

    @Test
    @DisplayName("writes instants as ISO-8601 strings and the canonical type name")
    void isoInstants() {
        String json = EventSerializer.serialize(usageEvent());

        assertThat(json).contains("\"occurredAt\":\"2026-02-01T10:00:00Z\"");
        assertThat(json).contains("\"eventType\":\"UsageRecorded\"");
        assertThat(json).contains("\"projectId\":\"project-1\"");
    }

    @Nested
    @DisplayName("deserialize")
    class Deserialize {

        @Test
        @DisplayName("resolves the payload record from the event type")
        void typedPayload() {
            var original = usageEvent();

            EventEnvelope<?> restored = EventSerializer.deserialize(EventSerializer.serialize(original));

            assertThat(restored.payload()).isInstanceOfSatisfying(UsageRecordedPayload.class, payload ->
                    assertThat(payload.cost()).isEqualByComparingTo("0.25"));
            assertThat(restored.entity()).isEqualTo(original.entity());
            assertThat(restored.occurredAt()).isEqualTo(original.occurredAt());
        }

        @Test
        @DisplayName("reads platform events without a project")
        void platformEvent() {
            var event = EventFactory.create(EventType.CIRCUIT_STATE_CHANGED, "gateway-service", null, "corr-2",
                    Instant.parse("2026-02-01T10:00:00Z"), EventEntity.of(EntityType.DEPENDENCY, "generation", 0),
                    new CircuitStateChangedPayload("generation", "CLOSED", "OPEN"));

            EventEnvelope<?> restored = EventSerializer.deserialize(EventSerializer.serialize(event));

            assertThat(restored.projectId()).isNull();
            assertThat(restored.payload()).isEqualTo(new CircuitStateChangedPayload("generation", "CLOSED", "OPEN"));
        }

        @Test
        @DisplayName("rejects malformed json")
        void malformed() {
            assertThatThrownBy(() -> EventSerializer.deserialize("{not json"))
                    .isInstanceOf(EventSerializer.EventSerializationException.class)
                    .hasMessage("malformed event json");
        }

        @Test
        @DisplayName("rejects unknown event types")
        void unknownType() {
            assertThatThrownBy(() -> EventSerializer.deserialize("{\"eventType\":\"TradeExecuted\"}"))
                    .isInstanceOf(EventSerializer.EventSerializationException.class)
                    .hasMessageContaining("TradeExecuted");
        }
    }
}
