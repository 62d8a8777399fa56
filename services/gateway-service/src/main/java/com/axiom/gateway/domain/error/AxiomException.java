package com.axiom.gateway.domain.error;

import java.util.Map;

/**
 * Base class for gateway failures that map directly to an error envelope code.
 * {@code details} is optional structured context for the client.
 */
public abstract class AxiomException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected AxiomException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected AxiomException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public Map<String, Object> details() {
        return details;
    }
}
