package com.axiom.gateway.domain.admission;

import com.axiom.eventmodel.EntityType;
import com.axiom.eventmodel.EventEntity;
import com.axiom.eventmodel.EventType;
import com.axiom.eventmodel.payload.CircuitStateChangedPayload;
import com.axiom.gateway.domain.event.DomainEvents;
import com.axiom.gateway.domain.event.EventPublisher;
import com.axiom.observability.MetricFactory;
import com.axiom.resilience.CircuitState;
import com.axiom.resilience.CircuitStateListener;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs, counts and announces dependency breaker transitions. Opening is logged at WARN,
 * every other transition at INFO.
 */
public class CircuitTransitionListener implements CircuitStateListener {

    private static final Logger log = LoggerFactory.getLogger(CircuitTransitionListener.class);

    private final EventPublisher events;
    private final MetricFactory metrics;
    private final Clock clock;

    public CircuitTransitionListener(EventPublisher events, MetricFactory metrics, Clock clock) {
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void onStateChange(String breakerName, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit for {} opened (was {})", breakerName, from);
        } else {
            log.info("Circuit for {} moved {} -> {}", breakerName, from, to);
        }
        metrics.counter("axiom.circuit.transitions", "Dependency circuit breaker state transitions",
                "dependency", breakerName, "from", from.name(), "to", to.name()).increment();
        events.publish(DomainEvents.of(EventType.CIRCUIT_STATE_CHANGED, null,
                EventEntity.of(EntityType.DEPENDENCY, breakerName, 0),
                new CircuitStateChangedPayload(breakerName, from.name(), to.name()), clock));
    }
}
