package com.axiom.gateway.domain.error;

import com.axiom.resilience.RateLimitDecision;

/** The caller's token bucket is empty. */
public class RateLimitedException extends AdmissionDeniedException {

    private final RateLimitDecision decision;

    public RateLimitedException(RateLimitDecision decision) {
        super(ErrorCode.RATE_LIMITED, "rate limit exceeded", decision.retryAfter(), null);
        this.decision = decision;
    }

    public RateLimitDecision decision() {
        return decision;
    }
}
