package com.axiom.gateway.infrastructure.web;

import com.axiom.resilience.RateLimitDecision;
import org.springframework.http.HttpHeaders;

/** {@code X-RateLimit-*} response headers for a limiter decision. */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";

    private RateLimitHeaders() {
    }

    public static HttpHeaders of(RateLimitDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        if (decision != null) {
            headers.set(LIMIT, String.valueOf(decision.limit()));
            headers.set(REMAINING, String.valueOf(decision.remaining()));
        }
        return headers;
    }
}
