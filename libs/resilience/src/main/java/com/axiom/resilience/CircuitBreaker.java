package com.axiom.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-state circuit breaker guarding one downstream dependency.
 * <ul>
 *   <li>CLOSED: calls pass. A success resets the failure count; reaching
 *       {@code failureThreshold} consecutive failures opens the circuit.</li>
 *   <li>OPEN: calls are rejected until more than {@code timeout} has passed since the last
 *       failure. The first check after that moves to HALF_OPEN and is allowed.</li>
 *   <li>HALF_OPEN: one trial call at a time. {@code successThreshold} successes close the
 *       circuit; any failure reopens it. A trial whose outcome is never recorded stops
 *       blocking once {@code timeout} has passed.</li>
 * </ul>
 * Callers must report every allowed call through {@link #recordSuccess()} or
 * {@link #recordFailure()}.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration timeout;
    private final Clock clock;
    private final CircuitStateListener listener;

    private final ReentrantLock lock = new ReentrantLock();
    private CircuitState state = CircuitState.CLOSED;
    private int failures;
    private int successes;
    private Instant lastFailureTime;
    private Instant trialStartedAt;

    public CircuitBreaker(String name, int failureThreshold, int successThreshold, Duration timeout,
                          Clock clock, CircuitStateListener listener) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new IllegalArgumentException("thresholds must be positive");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.timeout = timeout;
        this.clock = clock;
        this.listener = listener != null ? listener : CircuitStateListener.NONE;
    }

    /**
     * Decides whether a call to the dependency may proceed.
     */
    public boolean allow() {
        boolean halfOpened = false;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitState.CLOSED) {
                return true;
            }
            if (state == CircuitState.OPEN) {
                if (Duration.between(lastFailureTime, now).compareTo(timeout) <= 0) {
                    return false;
                }
                state = CircuitState.HALF_OPEN;
                trialStartedAt = now;
                halfOpened = true;
            } else if (trialStartedAt != null
                    && Duration.between(trialStartedAt, now).compareTo(timeout) <= 0) {
                return false;
            } else {
                trialStartedAt = now;
            }
        } finally {
            lock.unlock();
        }
        if (halfOpened) {
            fire(CircuitState.OPEN, CircuitState.HALF_OPEN);
        }
        return true;
    }

    /**
     * Records a successful call.
     */
    public void recordSuccess() {
        boolean closed = false;
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                trialStartedAt = null;
                successes++;
                if (successes >= successThreshold) {
                    state = CircuitState.CLOSED;
                    failures = 0;
                    successes = 0;
                    closed = true;
                }
            } else if (state == CircuitState.CLOSED) {
                failures = 0;
            }
        } finally {
            lock.unlock();
        }
        if (closed) {
            fire(CircuitState.HALF_OPEN, CircuitState.CLOSED);
        }
    }

    /**
     * Records a failed call. Failures while OPEN push the retry window further out.
     */
    public void recordFailure() {
        CircuitState from = null;
        lock.lock();
        try {
            failures++;
            lastFailureTime = clock.instant();
            if (state == CircuitState.CLOSED && failures >= failureThreshold) {
                from = state;
                state = CircuitState.OPEN;
            } else if (state == CircuitState.HALF_OPEN) {
                from = state;
                state = CircuitState.OPEN;
                successes = 0;
                trialStartedAt = null;
            }
        } finally {
            lock.unlock();
        }
        if (from != null) {
            fire(from, CircuitState.OPEN);
        }
    }

    /**
     * Gives back a half-open trial slot obtained from {@link #allow()} when the call was never
     * made. No outcome is recorded and the state does not change.
     */
    public void releaseTrial() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                trialStartedAt = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time left before the circuit admits another call: the open window while OPEN, and the
     * in-flight trial's window while HALF_OPEN. Zero when a call would be admitted now.
     */
    public Duration remainingOpenTime() {
        lock.lock();
        try {
            Instant since;
            if (state == CircuitState.OPEN) {
                since = lastFailureTime;
            } else if (state == CircuitState.HALF_OPEN && trialStartedAt != null) {
                since = trialStartedAt;
            } else {
                return Duration.ZERO;
            }
            Duration remaining = timeout.minus(Duration.between(since, clock.instant()));
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int failureCount() {
        lock.lock();
        try {
            return failures;
        } finally {
            lock.unlock();
        }
    }

    public int successCount() {
        lock.lock();
        try {
            return successes;
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    public Duration timeout() {
        return timeout;
    }

    private void fire(CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("[Breaker:{}] State changed: {} -> {}", name, from, to);
        } else {
            log.info("[Breaker:{}] State changed: {} -> {}", name, from, to);
        }
        try {
            listener.onStateChange(name, from, to);
        } catch (RuntimeException e) {
            log.error("[Breaker:{}] State listener failed", name, e);
        }
    }
}
