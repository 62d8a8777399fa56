package com.axiom.gateway.domain.admission;

/** Rate limit tiers; each maps to one configured limiter. */
public enum RateLimitTier {
    DEFAULT,
    STRICT
}
