package com.axiom.gateway.domain.error;

/** A store read or write failed for reasons other than a missing row. */
public class PersistenceException extends AxiomException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.DATABASE_ERROR, message, null, cause);
    }

    protected PersistenceException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, null, cause);
    }
}
