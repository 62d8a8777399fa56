package com.axiom.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deep health report: the overall status plus one entry per registered component, in
 * registration order.
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }
}
