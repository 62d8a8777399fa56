package com.axiom.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "gateway-service");
    }

    @Test
    @DisplayName("should reject a missing registry or service name")
    void shouldRejectBadConstruction() {
        assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("counter")
    class Counters {

        @Test
        @DisplayName("should carry the service tag next to the given tags")
        void carriesServiceTag() {
            factory.counter("axiom.admission.denials", "denials", "gate", "rate_limit").increment();

            var counter = registry.find("axiom.admission.denials")
                    .tag(MetricFactory.TAG_SERVICE, "gateway-service")
                    .tag("gate", "rate_limit")
                    .counter();
            assertThat(counter).isNotNull();
            assertThat(counter.count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep one meter per tag combination")
        void separatesTagCombinations() {
            factory.counter("axiom.admission.denials", "denials", "gate", "budget").increment();
            factory.counter("axiom.admission.denials", "denials", "gate", "budget").increment();
            factory.counter("axiom.admission.denials", "denials", "gate", "circuit").increment();

            assertThat(registry.get("axiom.admission.denials").tag("gate", "budget").counter().count())
                    .isEqualTo(2.0);
            assertThat(registry.get("axiom.admission.denials").tag("gate", "circuit").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject a dangling tag key")
        void rejectsOddTags() {
            assertThatThrownBy(() -> factory.counter("axiom.admission.denials", "denials", "gate"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("key/value pairs");
        }
    }

    @Test
    @DisplayName("amounts should record totals in the base unit")
    void amountsRecordTotals() {
        var spend = factory.amounts("axiom.budget.spend", "spend", "usd", "operation", "generation");
        spend.record(0.05);
        spend.record(0.25);

        var summary = registry.get("axiom.budget.spend").tag("operation", "generation").summary();
        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isCloseTo(0.30, within(1e-9));
        assertThat(summary.getId().getBaseUnit()).isEqualTo("usd");
    }
}
