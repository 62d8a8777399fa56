package com.axiom.gateway.config;

import com.axiom.gateway.domain.access.ProjectAccessAuthorizer;
import com.axiom.gateway.domain.access.ProjectDirectory;
import com.axiom.gateway.domain.access.ProjectTeamService;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.CircuitTransitionListener;
import com.axiom.gateway.domain.admission.Dependencies;
import com.axiom.gateway.domain.admission.RateLimitTier;
import com.axiom.gateway.domain.budget.BudgetGuard;
import com.axiom.gateway.domain.budget.BudgetRepository;
import com.axiom.gateway.domain.certificate.CertificateIssuer;
import com.axiom.gateway.domain.certificate.CertificateRepository;
import com.axiom.gateway.domain.certificate.CertificateService;
import com.axiom.gateway.domain.event.EventPublisher;
import com.axiom.gateway.domain.ivcu.CodeGenerationClient;
import com.axiom.gateway.domain.ivcu.IvcuRepository;
import com.axiom.gateway.domain.ivcu.IvcuService;
import com.axiom.gateway.domain.ivcu.IvcuStateMachine;
import com.axiom.gateway.domain.ivcu.VerificationClient;
import com.axiom.observability.MetricFactory;
import com.axiom.observability.SpanHelper;
import com.axiom.resilience.CircuitBreakerRegistry;
import com.axiom.resilience.TokenBucketRateLimiter;
import com.axiom.security.TokenAuthenticator;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the plain-Java domain services to their Spring-managed adapters and settings.
 */
@Configuration
@EnableConfigurationProperties({
        ServiceProperties.class,
        SecurityProperties.class,
        RateLimitProperties.class,
        CircuitBreakerProperties.class,
        BudgetProperties.class,
        IvcuProperties.class,
        CertificateProperties.class,
        ClientProperties.class
})
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("axiom-gateway"));
    }

    @Bean
    public TokenAuthenticator tokenAuthenticator(SecurityProperties security, Clock clock) {
        return new TokenAuthenticator(security.jwtSecret(), security.tokenLifetime(), clock);
    }

    @Bean
    public Map<RateLimitTier, TokenBucketRateLimiter> rateLimiters(RateLimitProperties rateLimit, Clock clock) {
        Map<RateLimitTier, TokenBucketRateLimiter> limiters = new EnumMap<>(RateLimitTier.class);
        limiters.put(RateLimitTier.DEFAULT, limiter("default", rateLimit.standard(), clock));
        limiters.put(RateLimitTier.STRICT, limiter("strict", rateLimit.strict(), clock));
        return limiters;
    }

    private static TokenBucketRateLimiter limiter(String name, RateLimitProperties.Tier tier, Clock clock) {
        return new TokenBucketRateLimiter(name, tier.maxTokens(), tier.refillRate(), tier.refillPeriod(), clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerProperties breaker, EventPublisher events,
                                                         MetricFactory metrics, Clock clock) {
        return new CircuitBreakerRegistry(Dependencies.ALL, breaker.failureThreshold(), breaker.successThreshold(),
                breaker.timeout(), clock, new CircuitTransitionListener(events, metrics, clock));
    }

    @Bean
    public ProjectAccessAuthorizer projectAccessAuthorizer(ProjectDirectory directory) {
        return new ProjectAccessAuthorizer(directory);
    }

    @Bean
    public ProjectTeamService projectTeamService(ProjectDirectory directory, ProjectAccessAuthorizer authorizer) {
        return new ProjectTeamService(directory, authorizer);
    }

    @Bean
    public BudgetGuard budgetGuard(BudgetRepository repository, EventPublisher events, MetricFactory metrics,
                                   BudgetProperties budget, Clock clock) {
        return new BudgetGuard(repository, events, metrics, budget.defaultLimit(), budget.failOpen(), clock);
    }

    @Bean
    public AdmissionController admissionController(TokenAuthenticator authenticator,
                                                   ProjectAccessAuthorizer authorizer,
                                                   Map<RateLimitTier, TokenBucketRateLimiter> rateLimiters,
                                                   CircuitBreakerRegistry breakers, BudgetGuard budgetGuard,
                                                   EventPublisher events, MetricFactory metrics, Clock clock) {
        return new AdmissionController(authenticator, authorizer, rateLimiters, breakers, budgetGuard, events,
                metrics, clock);
    }

    @Bean
    public IvcuStateMachine ivcuStateMachine(IvcuProperties ivcu) {
        return new IvcuStateMachine(ivcu.confidenceThreshold());
    }

    @Bean
    public IvcuService ivcuService(IvcuRepository repository, IvcuStateMachine stateMachine,
                                   CodeGenerationClient generationClient, VerificationClient verificationClient,
                                   AdmissionController admissions, BudgetGuard budgetGuard, EventPublisher events,
                                   Clock clock) {
        return new IvcuService(repository, stateMachine, generationClient, verificationClient, admissions,
                budgetGuard, events, clock);
    }

    @Bean
    public CertificateService certificateService(CertificateProperties certificate, Clock clock) {
        return new CertificateService(certificate.signingSecret(), certificate.verifierVersion(), clock);
    }

    @Bean
    public CertificateIssuer certificateIssuer(IvcuRepository ivcus, CertificateService certificateService,
                                               CertificateRepository certificates, EventPublisher events,
                                               MetricFactory metrics, SpanHelper spans, Clock clock) {
        return new CertificateIssuer(ivcus, certificateService, certificates, events, metrics, spans, clock);
    }
}
