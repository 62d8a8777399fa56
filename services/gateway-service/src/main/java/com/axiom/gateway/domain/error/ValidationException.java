package com.axiom.gateway.domain.error;

import java.util.Map;

/** Input or state transition rejected by a domain rule. */
public class ValidationException extends AxiomException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details, null);
    }
}
