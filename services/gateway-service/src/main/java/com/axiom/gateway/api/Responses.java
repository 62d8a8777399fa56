package com.axiom.gateway.api;

import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.infrastructure.web.RateLimitHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Builds admitted responses carrying the caller's rate limit headers. */
final class Responses {

    private Responses() {
    }

    static <T> ResponseEntity<T> ok(Admission admission, T body) {
        return status(HttpStatus.OK, admission, body);
    }

    static <T> ResponseEntity<T> created(Admission admission, T body) {
        return status(HttpStatus.CREATED, admission, body);
    }

    static <T> ResponseEntity<T> status(HttpStatus status, Admission admission, T body) {
        return ResponseEntity.status(status)
                .headers(RateLimitHeaders.of(admission.rateLimit()))
                .body(body);
    }
}
