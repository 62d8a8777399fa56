package com.axiom.gateway.domain.error;

import java.time.Duration;
import java.util.Map;

/** The circuit breaker for a downstream dependency is rejecting calls. */
public class CircuitOpenException extends AdmissionDeniedException {

    public CircuitOpenException(String dependency, Duration remainingOpenTime) {
        super(ErrorCode.CIRCUIT_OPEN,
                dependency + " service is temporarily unavailable due to repeated failures",
                remainingOpenTime, Map.of("dependency", dependency));
    }
}
