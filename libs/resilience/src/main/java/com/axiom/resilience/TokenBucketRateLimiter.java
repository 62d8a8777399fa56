package com.axiom.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key token bucket rate limiter.
 * <p>
 * Each key starts with a full bucket of {@code maxTokens}. Tokens are refilled in whole
 * periods: every elapsed {@code refillPeriod} adds {@code refillRate} tokens, capped at
 * {@code maxTokens}. Partial periods add nothing and do not move the refill mark.
 * <p>
 * Buckets live in process memory and reset on restart. Idle buckets are never evicted.
 */
public class TokenBucketRateLimiter {

    private final String name;
    private final int maxTokens;
    private final int refillRate;
    private final Duration refillPeriod;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Bucket> buckets = new HashMap<>();

    private static final class Bucket {
        private long tokens;
        private Instant lastRefill;

        private Bucket(long tokens, Instant lastRefill) {
            this.tokens = tokens;
            this.lastRefill = lastRefill;
        }
    }

    public TokenBucketRateLimiter(String name, int maxTokens, int refillRate, Duration refillPeriod, Clock clock) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be positive");
        }
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("refillPeriod must be positive");
        }
        this.name = name;
        this.maxTokens = maxTokens;
        this.refillRate = refillRate;
        this.refillPeriod = refillPeriod;
        this.clock = clock;
    }

    /**
     * Takes one token for the key if available.
     *
     * @return true if the request is allowed
     */
    public boolean allow(String key) {
        return tryAcquire(key).allowed();
    }

    /**
     * Takes one token for the key if available and reports the bucket state.
     * A denied decision suggests retrying after one refill period.
     */
    public RateLimitDecision tryAcquire(String key) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket(maxTokens, now));
            refill(bucket, now);

            if (bucket.tokens > 0) {
                bucket.tokens--;
                return new RateLimitDecision(true, (int) bucket.tokens, maxTokens, Duration.ZERO);
            }
            return new RateLimitDecision(false, 0, maxTokens, refillPeriod);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tokens currently held for the key, without refilling. Unseen keys report a full bucket.
     */
    public int remaining(String key) {
        lock.lock();
        try {
            Bucket bucket = buckets.get(key);
            return bucket == null ? maxTokens : (int) bucket.tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill(Bucket bucket, Instant now) {
        long elapsed = Duration.between(bucket.lastRefill, now).toNanos();
        long periods = elapsed / refillPeriod.toNanos();
        if (periods > 0) {
            long added = periods > maxTokens ? maxTokens : periods * refillRate;
            bucket.tokens = Math.min(maxTokens, bucket.tokens + added);
            bucket.lastRefill = now;
        }
    }

    public String name() {
        return name;
    }

    /** Bucket capacity. */
    public int limit() {
        return maxTokens;
    }

    public int refillRate() {
        return refillRate;
    }

    public Duration refillPeriod() {
        return refillPeriod;
    }
}
