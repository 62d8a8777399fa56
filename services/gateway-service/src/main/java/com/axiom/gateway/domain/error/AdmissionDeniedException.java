package com.axiom.gateway.domain.error;

import java.time.Duration;
import java.util.Map;

/**
 * A request was refused by an admission gate. Denials are expected outcomes, not faults.
 */
public abstract class AdmissionDeniedException extends AxiomException {

    private final Duration retryAfter;

    protected AdmissionDeniedException(ErrorCode errorCode, String message, Duration retryAfter,
                                       Map<String, Object> details) {
        super(errorCode, message, details, null);
        this.retryAfter = retryAfter;
    }

    /** Suggested wait before retrying; null when retrying will not help. */
    public Duration retryAfter() {
        return retryAfter;
    }
}
