package com.axiom.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Validates HS256-signed bearer tokens and issues new ones.
 * <p>
 * Only {@code HS256} is accepted. A token signed with another HMAC strength is rejected
 * even when the shared secret would verify it. Tokens without an expiry are rejected.
 */
public final class TokenAuthenticator {

    public static final String ALGORITHM = "HS256";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";

    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticator.class);

    private final SecretKey signingKey;
    private final Duration tokenLifetime;
    private final Clock clock;

    /**
     * @param secret        shared HMAC secret, at least 32 bytes in UTF-8
     * @param tokenLifetime lifetime of issued tokens
     * @param clock         clock used for issuing and for expiry checks
     */
    public TokenAuthenticator(String secret, Duration tokenLifetime, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalArgumentException("secret must be at least 32 bytes");
        }
        if (tokenLifetime == null || tokenLifetime.isZero() || tokenLifetime.isNegative()) {
            throw new IllegalArgumentException("tokenLifetime must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenLifetime = tokenLifetime;
        this.clock = clock;
    }

    /**
     * Authenticates the caller from a raw Authorization header value.
     *
     * @param authorizationHeader header value, e.g. {@code "Bearer eyJ..."} (may be null)
     * @return the principal named by the token
     * @throws AuthenticationException if the header is missing or the token is invalid
     */
    public AuthenticatedPrincipal authenticate(String authorizationHeader) {
        String token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new AuthenticationException("missing bearer token"));
        return validate(token);
    }

    /**
     * Validates a bare token (without the {@code Bearer} prefix).
     *
     * @throws AuthenticationException if the token is invalid
     */
    public AuthenticatedPrincipal validate(String token) {
        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new AuthenticationException("invalid token", e);
        }

        if (!ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
            log.debug("Rejected bearer token signed with {}", jws.getHeader().getAlgorithm());
            throw new AuthenticationException("unexpected signing method");
        }

        Claims claims = jws.getPayload();
        if (claims.getExpiration() == null) {
            throw new AuthenticationException("token has no expiry");
        }

        UUID userId;
        try {
            userId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new AuthenticationException("invalid subject", e);
        }

        try {
            return new AuthenticatedPrincipal(
                    userId,
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.get(CLAIM_ROLE, String.class));
        } catch (JwtException e) {
            log.debug("Rejected bearer token with malformed claims: {}", e.getMessage());
            throw new AuthenticationException("invalid claims", e);
        }
    }

    /**
     * Issues an HS256 token for the given user, valid for the configured lifetime.
     */
    public String issueToken(UUID userId, String email, String platformRole) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId.toString())
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLE, platformRole)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(tokenLifetime)))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /** Lifetime applied to issued tokens. */
    public Duration tokenLifetime() {
        return tokenLifetime;
    }
}
