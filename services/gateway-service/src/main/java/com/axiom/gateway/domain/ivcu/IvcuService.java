package com.axiom.gateway.domain.ivcu;

import com.axiom.eventmodel.EntityType;
import com.axiom.eventmodel.EventEntity;
import com.axiom.eventmodel.EventType;
import com.axiom.eventmodel.payload.IvcuStatusChangedPayload;
import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.GatedOperation;
import com.axiom.gateway.domain.budget.BudgetGuard;
import com.axiom.gateway.domain.budget.UsageDetails;
import com.axiom.gateway.domain.error.ResourceNotFoundException;
import com.axiom.gateway.domain.error.StaleIvcuException;
import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.gateway.domain.event.DomainEvents;
import com.axiom.gateway.domain.event.EventPublisher;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives IVCUs through their lifecycle: persists every transition, publishes
 * {@code IvcuStatusChanged}, and runs generation and verification against the collaborator
 * services with circuit breaker and usage bookkeeping.
 *
 * <p>Methods taking an {@link Admission} must only be called after the matching operation was
 * admitted. The outcome of every collaborator call is reported to its circuit breaker.
 */
public class IvcuService {

    private static final Logger log = LoggerFactory.getLogger(IvcuService.class);

    public static final String OPERATION_GENERATION = "generation";
    public static final String OPERATION_VERIFICATION = "verification";

    private final IvcuRepository repository;
    private final IvcuStateMachine stateMachine;
    private final CodeGenerationClient generationClient;
    private final VerificationClient verificationClient;
    private final AdmissionController admissions;
    private final BudgetGuard budgetGuard;
    private final EventPublisher events;
    private final Clock clock;

    public IvcuService(IvcuRepository repository, IvcuStateMachine stateMachine,
                       CodeGenerationClient generationClient, VerificationClient verificationClient,
                       AdmissionController admissions, BudgetGuard budgetGuard, EventPublisher events,
                       Clock clock) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.generationClient = generationClient;
        this.verificationClient = verificationClient;
        this.admissions = admissions;
        this.budgetGuard = budgetGuard;
        this.events = events;
        this.clock = clock;
    }

    public Ivcu get(UUID ivcuId) {
        return repository.findById(ivcuId)
                .orElseThrow(() -> new ResourceNotFoundException("ivcu", ivcuId));
    }

    /** Project owning the IVCU, used to scope admission for IVCU-addressed requests. */
    public UUID projectOf(UUID ivcuId) {
        return get(ivcuId).projectId();
    }

    /**
     * Creates a draft for the intent and generates its code synchronously. On success the IVCU
     * moves to VERIFYING and the reported cost is charged to the project. On failure it moves
     * to FAILED and the upstream error propagates.
     */
    public Ivcu startGeneration(Admission admission, String intent, List<String> constraints, String language) {
        UUID userId = admission.principal().userId();
        Instant now = clock.instant();

        Ivcu draft = Ivcu.draft(UUID.randomUUID(), admission.projectId(), intent, language, userId, now);
        Ivcu generating;
        try {
            repository.insert(draft);
            publishCreated(draft);
            generating = save(draft, IvcuStatus.GENERATING);
        } catch (RuntimeException e) {
            admissions.release(GatedOperation.START_GENERATION);
            throw e;
        }

        GeneratedCode generated;
        try {
            generated = guarded(GatedOperation.START_GENERATION, () -> generationClient.generate(
                    new GenerationRequest(draft.id(), draft.projectId(), intent, constraints, language)));
        } catch (RuntimeException e) {
            log.warn("Generation failed for ivcu {}: {}", draft.id(), e.getMessage());
            save(generating, IvcuStatus.FAILED);
            throw e;
        }

        Ivcu verifying = save(generating.withCode(generated.code(), generated.modelId(), clock.instant()),
                IvcuStatus.VERIFYING);
        budgetGuard.recordUsage(verifying.projectId(), userId, costOf(generated.cost()), OPERATION_GENERATION,
                UsageDetails.forIvcu(verifying.id(), generated.modelId(), language, "completed"));
        return verifying;
    }

    /** Stops a running generation; the IVCU becomes FAILED. */
    public Ivcu cancelGeneration(UUID ivcuId) {
        Ivcu ivcu = get(ivcuId);
        if (ivcu.status() != IvcuStatus.GENERATING) {
            throw new ValidationException("only generating ivcus can be cancelled",
                    Map.of("status", ivcu.status().value()));
        }
        log.info("Generation cancelled for ivcu {}", ivcuId);
        return save(ivcu, IvcuStatus.FAILED);
    }

    /**
     * Applies a workflow engine update to a generating IVCU. Completed generations move to
     * VERIFYING and are charged to the IVCU's creator; failed ones move to FAILED.
     */
    public Ivcu applyCallback(UUID ivcuId, GenerationCallback callback) {
        Ivcu ivcu = get(ivcuId);
        if (!callback.completed()) {
            log.info("Generation reported failed for ivcu {}: {}", ivcuId, callback.error());
            return save(ivcu, IvcuStatus.FAILED);
        }
        if (callback.code() == null || callback.code().isBlank()) {
            throw new ValidationException("completed generation must carry code");
        }
        Ivcu verifying = save(ivcu.withCode(callback.code(), callback.modelId(), clock.instant()),
                IvcuStatus.VERIFYING);
        if (verifying.createdBy() != null) {
            budgetGuard.recordUsage(verifying.projectId(), verifying.createdBy(), costOf(callback.cost()),
                    OPERATION_GENERATION,
                    UsageDetails.forIvcu(verifying.id(), callback.modelId(), verifying.language(), "completed"));
        }
        return verifying;
    }

    /**
     * Runs the verifiers over the IVCU's code and applies the aggregated outcome. Upstream
     * failures leave the IVCU in VERIFYING so the run can be repeated.
     */
    public VerificationRun verify(Admission admission, UUID ivcuId) {
        Ivcu ivcu = awaitingVerification(ivcuId);

        VerificationReport report = guarded(GatedOperation.RUN_VERIFICATION,
                () -> verificationClient.verify(ivcu.code(), ivcu.language()));
        VerificationOutcome outcome = VerificationOutcome.aggregate(report.results());

        Ivcu verified = stateMachine.applyVerification(ivcu, outcome, clock.instant());
        try {
            repository.update(verified, ivcu.status());
        } catch (StaleIvcuException e) {
            // The verifiers ran and cost money even though their outcome was discarded.
            log.warn("Verification result for ivcu {} discarded, unit changed concurrently", ivcuId);
            chargeVerification(admission, ivcu, report, "discarded");
            throw e;
        }
        publishStatusChange(verified, ivcu.status());
        log.info("Verification of ivcu {} finished: status={}, confidence={}",
                ivcuId, verified.status().value(), outcome.confidence());

        chargeVerification(admission, verified, report, verified.status().value());
        return new VerificationRun(verified, outcome);
    }

    private void chargeVerification(Admission admission, Ivcu ivcu, VerificationReport report, String outcome) {
        budgetGuard.recordUsage(ivcu.projectId(), admission.principal().userId(), report.cost(),
                OPERATION_VERIFICATION, UsageDetails.forIvcu(ivcu.id(), ivcu.modelId(), ivcu.language(), outcome));
    }

    /** Moves the IVCU to {@code target} if the lifecycle allows it. */
    public Ivcu transition(UUID ivcuId, IvcuStatus target) {
        return save(get(ivcuId), target);
    }

    /** Creates a new draft retrying a failed IVCU. */
    public Ivcu retry(UUID ivcuId, UUID requestedBy) {
        Ivcu retried = stateMachine.retry(get(ivcuId), UUID.randomUUID(), requestedBy, clock.instant());
        repository.insert(retried);
        publishCreated(retried);
        return retried;
    }

    /**
     * Creates a successor draft and deprecates the prior IVCU. Null intent or language keep the
     * prior's values. The prior is deprecated first, so a concurrent change to it leaves no
     * orphaned successor behind.
     */
    public Ivcu supersede(UUID ivcuId, UUID requestedBy, String rawIntent, String language) {
        Ivcu prior = get(ivcuId);
        Instant now = clock.instant();
        Ivcu successor = stateMachine.successorOf(prior, UUID.randomUUID(),
                rawIntent != null ? rawIntent : prior.rawIntent(),
                language != null ? language : prior.language(), requestedBy, now);
        Ivcu deprecated = stateMachine.supersede(prior, successor, now);

        repository.update(deprecated, prior.status());
        repository.insert(successor);
        publishCreated(successor);
        publishStatusChange(deprecated, prior.status());
        return successor;
    }

    private Ivcu awaitingVerification(UUID ivcuId) {
        try {
            Ivcu ivcu = get(ivcuId);
            if (ivcu.status() != IvcuStatus.VERIFYING) {
                throw new ValidationException("ivcu is not awaiting verification",
                        Map.of("status", ivcu.status().value()));
            }
            return ivcu;
        } catch (RuntimeException e) {
            admissions.release(GatedOperation.RUN_VERIFICATION);
            throw e;
        }
    }

    private <T> T guarded(GatedOperation operation, Supplier<T> call) {
        T result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            admissions.recordFailure(operation);
            throw e;
        }
        admissions.recordSuccess(operation);
        return result;
    }

    private Ivcu save(Ivcu ivcu, IvcuStatus target) {
        Ivcu moved = stateMachine.transition(ivcu, target, clock.instant());
        repository.update(moved, ivcu.status());
        publishStatusChange(moved, ivcu.status());
        return moved;
    }

    private void publishCreated(Ivcu ivcu) {
        events.publish(DomainEvents.of(EventType.IVCU_CREATED, ivcu.projectId(),
                EventEntity.of(EntityType.IVCU, ivcu.id().toString(), ivcu.version()),
                new IvcuStatusChangedPayload(ivcu.id().toString(), ivcu.version(), null, ivcu.status().value()),
                clock));
    }

    private void publishStatusChange(Ivcu ivcu, IvcuStatus from) {
        events.publish(DomainEvents.of(EventType.IVCU_STATUS_CHANGED, ivcu.projectId(),
                EventEntity.of(EntityType.IVCU, ivcu.id().toString(), ivcu.version()),
                new IvcuStatusChangedPayload(ivcu.id().toString(), ivcu.version(),
                        from.value(), ivcu.status().value()),
                clock));
    }

    private static BigDecimal costOf(BigDecimal cost) {
        return cost != null ? cost : BigDecimal.ZERO;
    }
}
