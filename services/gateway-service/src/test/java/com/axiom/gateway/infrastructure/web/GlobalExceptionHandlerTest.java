package com.axiom.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.axiom.gateway.domain.error.BudgetExceededException;
import com.axiom.gateway.domain.error.CircuitOpenException;
import com.axiom.gateway.domain.error.PersistenceException;
import com.axiom.gateway.domain.error.RateLimitedException;
import com.axiom.gateway.domain.error.ResourceNotFoundException;
import com.axiom.gateway.domain.error.StaleIvcuException;
import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.observability.CorrelationContext;
import com.axiom.observability.CorrelationContextHolder;
import com.axiom.resilience.RateLimitDecision;
import com.axiom.security.AuthenticationException;
import com.axiom.security.AuthorizationException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps authentication failures to 401 with a bearer challenge")
    void authentication() {
        ResponseEntity<ErrorResponse> result = handler.handleAuthentication(
                new AuthenticationException("invalid token"));

        assertThat(result.getStatusCode().value()).isEqualTo(401);
        assertThat(result.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
        assertThat(result.getBody().error().code()).isEqualTo("UNAUTHORIZED");
        assertThat(result.getBody().error().message()).isEqualTo("invalid token");
    }

    @Test
    @DisplayName("maps authorization failures to 403")
    void authorization() {
        ResponseEntity<ErrorResponse> result = handler.handleAuthorization(AuthorizationException.accessDenied());

        assertThat(result.getStatusCode().value()).isEqualTo(403);
        assertThat(result.getBody().error().code()).isEqualTo("FORBIDDEN");
        assertThat(result.getBody().error().message()).isEqualTo("access denied");
    }

    @Nested
    @DisplayName("admission denials")
    class AdmissionDenials {

        @Test
        @DisplayName("rate limiting carries limiter headers and a rounded-up Retry-After")
        void rateLimited() {
            var decision = new RateLimitDecision(false, 0, 100, Duration.ofMillis(1500));

            ResponseEntity<ErrorResponse> result = handler.handleAdmissionDenied(new RateLimitedException(decision));

            assertThat(result.getStatusCode().value()).isEqualTo(429);
            assertThat(result.getHeaders().getFirst(RateLimitHeaders.LIMIT)).isEqualTo("100");
            assertThat(result.getHeaders().getFirst(RateLimitHeaders.REMAINING)).isEqualTo("0");
            assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("2");
            assertThat(result.getBody().error().code()).isEqualTo("RATE_LIMITED");
            assertThat(result.getBody().error().retryAfterMs()).isEqualTo(1500L);
        }

        @Test
        @DisplayName("an open circuit reports 503 with the dependency and at least one second to wait")
        void circuitOpen() {
            ResponseEntity<ErrorResponse> result = handler.handleAdmissionDenied(
                    new CircuitOpenException("generation", Duration.ofMillis(200)));

            assertThat(result.getStatusCode().value()).isEqualTo(503);
            assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
            assertThat(result.getBody().error().code()).isEqualTo("CIRCUIT_OPEN");
            assertThat(result.getBody().error().details()).containsEntry("dependency", "generation");
        }

        @Test
        @DisplayName("an exhausted budget reports 402 without Retry-After")
        void budgetExceeded() {
            ResponseEntity<ErrorResponse> result = handler.handleAdmissionDenied(
                    new BudgetExceededException(new BigDecimal("0.02"), new BigDecimal("0.05")));

            assertThat(result.getStatusCode().value()).isEqualTo(402);
            assertThat(result.getHeaders().containsKey(HttpHeaders.RETRY_AFTER)).isFalse();
            assertThat(result.getBody().error().retryAfterMs()).isNull();
            assertThat(result.getBody().error().details())
                    .containsEntry("remaining_budget", new BigDecimal("0.02"))
                    .containsEntry("estimated_cost", new BigDecimal("0.05"));
        }
    }

    @Nested
    @DisplayName("domain failures")
    class DomainFailures {

        @Test
        @DisplayName("use the status of their error code")
        void notFound() {
            ResponseEntity<ErrorResponse> result = handler.handleAxiom(new ResourceNotFoundException("ivcu", "42"));

            assertThat(result.getStatusCode().value()).isEqualTo(404);
            assertThat(result.getBody().error().code()).isEqualTo("NOT_FOUND");
            assertThat(result.getBody().error().details()).isEqualTo(Map.of("id", "42"));
        }

        @Test
        @DisplayName("omit empty details")
        void emptyDetails() {
            ResponseEntity<ErrorResponse> result = handler.handleAxiom(new ValidationException("bad status"));

            assertThat(result.getStatusCode().value()).isEqualTo(400);
            assertThat(result.getBody().error().details()).isNull();
        }

        @Test
        @DisplayName("persistence failures map to 500 DATABASE_ERROR")
        void persistence() {
            ResponseEntity<ErrorResponse> result = handler.handleAxiom(
                    new PersistenceException("failed to read ivcu", new IllegalStateException("down")));

            assertThat(result.getStatusCode().value()).isEqualTo(500);
            assertThat(result.getBody().error().code()).isEqualTo("DATABASE_ERROR");
        }

        @Test
        @DisplayName("a transition lost to a concurrent request maps to 409 CONFLICT")
        void staleTransition() {
            ResponseEntity<ErrorResponse> result = handler.handleAxiom(new StaleIvcuException("42", "generating"));

            assertThat(result.getStatusCode().value()).isEqualTo(409);
            assertThat(result.getBody().error().code()).isEqualTo("CONFLICT");
            assertThat(result.getBody().error().details()).containsEntry("expected_status", "generating");
        }
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 BAD_REQUEST")
    void illegalArgument() {
        ResponseEntity<ErrorResponse> result = handler.handleBadRequest(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatusCode().value()).isEqualTo(400);
        assertThat(result.getBody().error().code()).isEqualTo("BAD_REQUEST");
        assertThat(result.getBody().error().message()).isEqualTo("invalid input");
    }

    @Test
    @DisplayName("maps unsupported methods to 405")
    void methodNotAllowed() {
        ResponseEntity<ErrorResponse> result = handler.handleMethodNotSupported(
                new HttpRequestMethodNotSupportedException("DELETE"));

        assertThat(result.getStatusCode().value()).isEqualTo(405);
    }

    @Test
    @DisplayName("hides data access details behind DATABASE_ERROR")
    void dataAccess() {
        ResponseEntity<ErrorResponse> result = handler.handleDataAccess(
                new DataAccessResourceFailureException("connection refused to db-host:5432"));

        assertThat(result.getStatusCode().value()).isEqualTo(500);
        assertThat(result.getBody().error().message()).isEqualTo("database error");
    }

    @Test
    @DisplayName("maps unexpected exceptions to 500 without leaking their message")
    void generic() {
        ResponseEntity<ErrorResponse> result = handler.handleGeneric(new RuntimeException("secret internals"));

        assertThat(result.getStatusCode().value()).isEqualTo(500);
        assertThat(result.getBody().error().code()).isEqualTo("INTERNAL_ERROR");
        assertThat(result.getBody().error().message()).doesNotContain("secret");
    }

    @Test
    @DisplayName("includes the active correlation ID in the envelope")
    void correlationId() {
        CorrelationContextHolder.open(CorrelationContext.of("corr-77"));

        ResponseEntity<ErrorResponse> result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getBody().error().correlationId()).isEqualTo("corr-77");
    }
}
