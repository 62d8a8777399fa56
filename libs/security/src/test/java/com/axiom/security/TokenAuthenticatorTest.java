package com.axiom.security;

import com.axiom.security.testing.TestTokenFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenAuthenticator")
class TokenAuthenticatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final UUID USER = UUID.fromString("5f0c1d8e-7c7f-4c59-9a0e-3f1a2b3c4d5e");

    private final TokenAuthenticator authenticator =
            TestTokenFactory.authenticator(Clock.fixed(NOW, ZoneOffset.UTC));

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject secrets shorter than 32 bytes")
        void shortSecret() {
            assertThatThrownBy(() -> new TokenAuthenticator("too-short", Duration.ofHours(1), Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject non-positive lifetime")
        void badLifetime() {
            assertThatThrownBy(() -> new TokenAuthenticator(TestTokenFactory.SECRET, Duration.ZERO, Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("valid tokens")
    class ValidTokens {

        @Test
        @DisplayName("issued token authenticates to the same principal")
        void issuedTokenAuthenticates() {
            String token = authenticator.issueToken(USER, "dev@example.com", "admin");

            AuthenticatedPrincipal principal = authenticator.authenticate("Bearer " + token);

            assertThat(principal.userId()).isEqualTo(USER);
            assertThat(principal.email()).isEqualTo("dev@example.com");
            assertThat(principal.platformRole()).isEqualTo("admin");
        }
    }

    @Nested
    @DisplayName("rejected credentials")
    class Rejected {

        @Test
        @DisplayName("missing header")
        void missingHeader() {
            assertThatThrownBy(() -> authenticator.authenticate(null))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("missing bearer token");
        }

        @Test
        @DisplayName("malformed token")
        void malformedToken() {
            assertThatThrownBy(() -> authenticator.authenticate("Bearer not.a.jwt"))
                    .isInstanceOf(AuthenticationException.class);
        }

        @Test
        @DisplayName("expired token")
        void expiredToken() {
            var issuedEarlier = TestTokenFactory.authenticator(
                    Clock.fixed(NOW.minus(Duration.ofHours(2)), ZoneOffset.UTC));
            String token = issuedEarlier.issueToken(USER, null, "user");

            assertThatThrownBy(() -> authenticator.validate(token))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("invalid token");
        }

        @Test
        @DisplayName("token signed with a different secret")
        void wrongSecret() {
            var other = new TokenAuthenticator("another-secret-another-secret-another-secret",
                    Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));
            String token = other.issueToken(USER, null, "user");

            assertThatThrownBy(() -> authenticator.validate(token))
                    .isInstanceOf(AuthenticationException.class);
        }

        @Test
        @DisplayName("unsigned token")
        void unsignedToken() {
            var systemAuthenticator = TestTokenFactory.authenticator();

            assertThatThrownBy(() -> systemAuthenticator.validate(TestTokenFactory.unsignedTokenFor(USER)))
                    .isInstanceOf(AuthenticationException.class);
        }

        @Test
        @DisplayName("token signed with HS512 using the shared secret")
        void hs512Token() {
            var systemAuthenticator = TestTokenFactory.authenticator();

            assertThatThrownBy(() -> systemAuthenticator.validate(TestTokenFactory.hs512TokenFor(USER)))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("unexpected signing method");
        }

        @Test
        @DisplayName("subject that is not a UUID")
        void nonUuidSubject() {
            var systemAuthenticator = TestTokenFactory.authenticator();

            assertThatThrownBy(() -> systemAuthenticator.validate(TestTokenFactory.tokenWithSubject("alice")))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("invalid subject");
        }

        @Test
        @DisplayName("email or role claim that is not a string")
        void nonStringClaim() {
            var systemAuthenticator = TestTokenFactory.authenticator();

            assertThatThrownBy(() -> systemAuthenticator.validate(
                    TestTokenFactory.tokenWithClaim(USER, TokenAuthenticator.CLAIM_EMAIL, 42)))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("invalid claims");
            assertThatThrownBy(() -> systemAuthenticator.validate(
                    TestTokenFactory.tokenWithClaim(USER, TokenAuthenticator.CLAIM_ROLE, List.of("admin"))))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("invalid claims");
        }
    }
}
