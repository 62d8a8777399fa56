package com.axiom.security;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the credential out of an {@code Authorization: Bearer <token>} header.
 * The scheme is case-insensitive and the token must be a single run of non-space characters.
 */
public final class BearerTokenExtractor {

    private static final Pattern BEARER = Pattern.compile("\\s*bearer\\s+(\\S+)\\s*", Pattern.CASE_INSENSITIVE);

    private BearerTokenExtractor() {
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @return the token, or empty when the header is absent, uses another scheme or is malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        Matcher matcher = BEARER.matcher(authorizationHeader);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
