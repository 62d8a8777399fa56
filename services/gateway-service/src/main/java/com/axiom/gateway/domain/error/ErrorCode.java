package com.axiom.gateway.domain.error;

/**
 * Client-facing error codes and the HTTP status each maps to.
 */
public enum ErrorCode {
    UNAUTHORIZED(401),
    FORBIDDEN(403),
    NOT_FOUND(404),
    RATE_LIMITED(429),
    CIRCUIT_OPEN(503),
    BUDGET_EXCEEDED(402),
    VALIDATION_ERROR(400),
    BAD_REQUEST(400),
    CONFLICT(409),
    INTEGRITY_VIOLATION(422),
    AI_SERVICE_UNAVAILABLE(503),
    DATABASE_ERROR(500),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
