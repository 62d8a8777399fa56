package com.axiom.security;

/**
 * Thrown when an authenticated principal may not perform an operation on a project.
 * <p>
 * The message is client-facing: "access denied" when the principal has no role on the
 * project, "insufficient permissions" when the role lacks the required permission.
 */
public class AuthorizationException extends RuntimeException {

    public static final String ACCESS_DENIED = "access denied";
    public static final String INSUFFICIENT_PERMISSIONS = "insufficient permissions";

    public AuthorizationException(String message) {
        super(message);
    }

    public static AuthorizationException accessDenied() {
        return new AuthorizationException(ACCESS_DENIED);
    }

    public static AuthorizationException insufficientPermissions() {
        return new AuthorizationException(INSUFFICIENT_PERMISSIONS);
    }
}
