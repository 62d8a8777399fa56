package com.axiom.observability;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the registered {@link HealthCheck}s concurrently and folds them into one
 * {@link HealthResult}.
 *
 * <p>Components are either critical (the database) or optional (a breaker-protected
 * dependency). A failing critical component makes the gateway UNHEALTHY; an optional one can
 * only make it DEGRADED. A check that times out or completes exceptionally counts as failing.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private record Registration(HealthCheck check, boolean critical) {
    }

    private final Map<String, Registration> checks = new LinkedHashMap<>();
    private final Duration timeout;
    private final Clock clock;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT, Clock.systemUTC());
    }

    public HealthCheckRegistry(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
        this.clock = clock;
    }

    /** Registers a critical component, replacing any check of the same name. */
    public synchronized void register(String name, HealthCheck check) {
        register(name, check, true);
    }

    /** Registers a component the gateway can keep serving without. */
    public synchronized void registerOptional(String name, HealthCheck check) {
        register(name, check, false);
    }

    private void register(String name, HealthCheck check, boolean critical) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, new Registration(check, critical));
    }

    public synchronized boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    public HealthResult checkAll() {
        Map<String, Registration> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(checks);
        }

        Map<String, CompletableFuture<ComponentHealth>> running = new LinkedHashMap<>();
        snapshot.forEach((name, registration) -> running.put(name, start(name, registration.check())));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : running.entrySet()) {
            String name = entry.getKey();
            ComponentHealth health = await(name, entry.getValue());
            results.put(name, health);
            HealthStatus contribution = snapshot.get(name).critical()
                    ? health.status()
                    : health.status().atMostDegraded();
            overall = overall.worst(contribution);
        }
        return new HealthResult(overall, results, clock.instant());
    }

    private CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ComponentHealth await(String name, CompletableFuture<ComponentHealth> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause instanceof TimeoutException
                    ? "no answer within " + timeout.toMillis() + " ms"
                    : "check failed: " + cause.getMessage();
            log.warn("Health check {} failed: {}", name, message);
            return ComponentHealth.unhealthy(name, message, timeout.toMillis());
        }
    }

    public synchronized int size() {
        return checks.size();
    }

    public Duration timeout() {
        return timeout;
    }
}
