package com.axiom.gateway.domain.admission;

import com.axiom.eventmodel.EntityType;
import com.axiom.eventmodel.EventEntity;
import com.axiom.eventmodel.EventType;
import com.axiom.eventmodel.payload.AdmissionDeniedPayload;
import com.axiom.gateway.domain.access.ProjectAccessAuthorizer;
import com.axiom.gateway.domain.budget.BudgetGuard;
import com.axiom.gateway.domain.budget.BudgetStatus;
import com.axiom.gateway.domain.error.BudgetExceededException;
import com.axiom.gateway.domain.error.CircuitOpenException;
import com.axiom.gateway.domain.error.ErrorCode;
import com.axiom.gateway.domain.error.RateLimitedException;
import com.axiom.gateway.domain.event.DomainEvents;
import com.axiom.gateway.domain.event.EventPublisher;
import com.axiom.observability.CorrelationContextHolder;
import com.axiom.observability.MetricFactory;
import com.axiom.resilience.CircuitBreaker;
import com.axiom.resilience.CircuitBreakerRegistry;
import com.axiom.resilience.RateLimitDecision;
import com.axiom.resilience.TokenBucketRateLimiter;
import com.axiom.security.AuthenticatedPrincipal;
import com.axiom.security.AuthenticationException;
import com.axiom.security.AuthorizationException;
import com.axiom.security.ProjectRole;
import com.axiom.security.TokenAuthenticator;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the admission gates for a request in a fixed order: authenticate, authorize, rate limit,
 * circuit breaker, budget. The first denial ends the pipeline and later gates are not consulted.
 *
 * <p>Admission does not record outcomes. Callers that were admitted to a guarded dependency
 * report the call result through {@link #recordSuccess} or {@link #recordFailure}, and record
 * actual spend through {@link BudgetGuard#recordUsage}.
 *
 * <p>Every denial is counted under {@code axiom.admission.denials} tagged with its gate and
 * logged at INFO. An {@code AdmissionDenied} event is published when the denial can be
 * attributed to a project or a dependency.
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final TokenAuthenticator authenticator;
    private final ProjectAccessAuthorizer authorizer;
    private final Map<RateLimitTier, TokenBucketRateLimiter> limiters;
    private final CircuitBreakerRegistry breakers;
    private final BudgetGuard budgetGuard;
    private final EventPublisher events;
    private final MetricFactory metrics;
    private final Clock clock;
    private final Counter admitted;

    public AdmissionController(TokenAuthenticator authenticator, ProjectAccessAuthorizer authorizer,
                               Map<RateLimitTier, TokenBucketRateLimiter> limiters,
                               CircuitBreakerRegistry breakers, BudgetGuard budgetGuard,
                               EventPublisher events, MetricFactory metrics, Clock clock) {
        for (RateLimitTier tier : RateLimitTier.values()) {
            if (!limiters.containsKey(tier)) {
                throw new IllegalArgumentException("No rate limiter configured for tier " + tier);
            }
        }
        this.authenticator = authenticator;
        this.authorizer = authorizer;
        this.limiters = new EnumMap<>(limiters);
        this.breakers = breakers;
        this.budgetGuard = budgetGuard;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
        this.admitted = metrics.counter("axiom.admission.decisions", "Requests admitted through all gates");
    }

    /**
     * @return the admission, never null
     * @throws AuthenticationException when the credential is missing or invalid
     * @throws AuthorizationException when the principal may not perform the operation
     * @throws RateLimitedException when the caller's bucket is empty
     * @throws CircuitOpenException when the operation's dependency is unavailable
     * @throws BudgetExceededException when the project cannot afford the estimated cost
     */
    public Admission admit(AdmissionRequest request) {
        GatedOperation operation = request.operation();

        AuthenticatedPrincipal principal = null;
        if (operation.requiresAuthentication()) {
            try {
                principal = authenticator.authenticate(request.authorizationHeader());
            } catch (AuthenticationException e) {
                denied(Gate.AUTHENTICATE, operation, ErrorCode.UNAUTHORIZED, subject(null, request), null, e);
                throw e;
            }
            String userId = principal.userId().toString();
            CorrelationContextHolder.update(ctx -> ctx.withUserId(userId));
        }

        UUID projectId = null;
        ProjectRole role = null;
        if (operation.projectScoped()) {
            projectId = request.projectResolver().get();
            String project = projectId.toString();
            CorrelationContextHolder.update(ctx -> ctx.withProjectId(project));
            try {
                role = authorizer.authorize(principal, projectId, operation.permission());
            } catch (AuthorizationException e) {
                denied(Gate.AUTHORIZE, operation, ErrorCode.FORBIDDEN, subject(principal, request), projectId, e);
                throw e;
            }
        }

        TokenBucketRateLimiter limiter = limiters.get(operation.tier());
        RateLimitDecision rateLimit = limiter.tryAcquire(subject(principal, request));
        if (!rateLimit.allowed()) {
            var e = new RateLimitedException(rateLimit);
            denied(Gate.RATE_LIMIT, operation, ErrorCode.RATE_LIMITED, subject(principal, request), projectId, e);
            throw e;
        }

        CircuitBreaker breaker = null;
        if (operation.dependency() != null) {
            breaker = breakers.get(operation.dependency());
            if (!breaker.allow()) {
                var e = new CircuitOpenException(operation.dependency(), breaker.remainingOpenTime());
                denied(Gate.CIRCUIT_BREAKER, operation, ErrorCode.CIRCUIT_OPEN, subject(principal, request),
                        projectId, e);
                throw e;
            }
        }

        BudgetStatus budget = null;
        if (operation.incursCost()) {
            try {
                budget = budgetGuard.checkBudget(projectId, request.estimatedCost());
            } catch (RuntimeException e) {
                releaseTrial(breaker);
                throw e;
            }
            if (!budget.allowed()) {
                releaseTrial(breaker);
                var e = new BudgetExceededException(budget.remaining(), request.estimatedCost());
                denied(Gate.BUDGET, operation, ErrorCode.BUDGET_EXCEEDED, subject(principal, request), projectId, e);
                throw e;
            }
        }

        admitted.increment();
        return new Admission(principal, projectId, role, rateLimit, budget);
    }

    /** Reports a successful call to the operation's dependency. No-op for unguarded operations. */
    public void recordSuccess(GatedOperation operation) {
        if (operation.dependency() != null) {
            breakers.get(operation.dependency()).recordSuccess();
        }
    }

    /** Reports a failed call to the operation's dependency. No-op for unguarded operations. */
    public void recordFailure(GatedOperation operation) {
        if (operation.dependency() != null) {
            breakers.get(operation.dependency()).recordFailure();
        }
    }

    /**
     * Gives back a half-open trial slot when an admitted call to the dependency is abandoned
     * before it was made.
     */
    public void release(GatedOperation operation) {
        if (operation.dependency() != null) {
            breakers.get(operation.dependency()).releaseTrial();
        }
    }

    private static void releaseTrial(CircuitBreaker breaker) {
        if (breaker != null) {
            breaker.releaseTrial();
        }
    }

    private static String subject(AuthenticatedPrincipal principal, AdmissionRequest request) {
        return rateLimitKey(principal, request.clientAddress());
    }

    /** Principal id when authenticated, otherwise the client address. */
    static String rateLimitKey(AuthenticatedPrincipal principal, String clientAddress) {
        if (principal != null) {
            return "user:" + principal.userId();
        }
        return "ip:" + (clientAddress != null ? clientAddress : "unknown");
    }

    private void denied(Gate gate, GatedOperation operation, ErrorCode code, String subject, UUID projectId,
                        RuntimeException cause) {
        metrics.counter("axiom.admission.denials", "Requests denied by an admission gate",
                "gate", gate.value(), "operation", operation.name()).increment();
        log.info("Admission denied at {} for {} ({}): {}", gate.value(), operation, subject, cause.getMessage());

        EventEntity entity = null;
        if (projectId != null) {
            entity = EventEntity.of(EntityType.PROJECT, projectId.toString(), 0);
        } else if (gate == Gate.CIRCUIT_BREAKER) {
            entity = EventEntity.of(EntityType.DEPENDENCY, operation.dependency(), 0);
        }
        if (entity != null) {
            events.publish(DomainEvents.of(EventType.ADMISSION_DENIED, projectId, entity,
                    new AdmissionDeniedPayload(operation.name(), gate.value(), code.name(), subject), clock));
        }
    }
}
