package com.axiom.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Creates the gateway's Micrometer meters, each stamped with a {@code service} tag.
 * <p>
 * Extra tags are given as alternating key/value strings. Micrometer registers meters
 * idempotently, so callers may look a meter up again on every use (per-gate denial counters
 * do this) instead of holding a reference.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * Counter for discrete occurrences: admissions, denials, issued certificates.
     *
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(withService(tags))
                .register(registry);
    }

    /**
     * Summary of recorded amounts in {@code baseUnit}, such as spend in USD per operation.
     *
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    public DistributionSummary amounts(String name, String description, String baseUnit, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .baseUnit(baseUnit)
                .tags(withService(tags))
                .register(registry);
    }

    private Tags withService(String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs, got " + tags.length + " values");
        }
        return serviceTags.and(tags);
    }
}
