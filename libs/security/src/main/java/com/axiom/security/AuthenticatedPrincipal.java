package com.axiom.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Caller identity extracted from a validated bearer token. Derived per request and never stored.
 *
 * @param userId       unique user identifier (from the token's {@code sub} claim)
 * @param email        user's email address (may be null)
 * @param platformRole platform-wide role label (e.g. "user", "admin"); unrelated to project roles
 */
public record AuthenticatedPrincipal(UUID userId, String email, String platformRole) {

    public AuthenticatedPrincipal {
        Objects.requireNonNull(userId, "userId must not be null");
    }
}
