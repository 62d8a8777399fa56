package com.axiom.resilience;

import java.time.Duration;

/**
 * Outcome of a single rate-limit check.
 *
 * @param allowed    whether a token was taken
 * @param remaining  tokens left in the bucket after the check
 * @param limit      bucket capacity
 * @param retryAfter suggested wait before retrying; zero when allowed
 */
public record RateLimitDecision(boolean allowed, int remaining, int limit, Duration retryAfter) {
}
