package com.axiom.security;

/**
 * Thrown when a request carries no credential or a credential that fails validation
 * (malformed, expired, unsigned, wrong algorithm, bad signature, invalid subject).
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
