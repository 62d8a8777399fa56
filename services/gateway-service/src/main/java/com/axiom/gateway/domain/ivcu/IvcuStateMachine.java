package com.axiom.gateway.domain.ivcu;

import com.axiom.gateway.domain.error.ValidationException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Legal IVCU lifecycle moves.
 *
 * <pre>
 * DRAFT -> GENERATING -> VERIFYING -> VERIFIED -> DEPLOYED
 *              |             |
 *              +-> FAILED <--+
 * any non-terminal state -> DEPRECATED (supersession)
 * </pre>
 *
 * Entering VERIFIED requires a confidence score at or above the configured threshold.
 * The machine is pure: it returns updated copies and never touches storage.
 */
public class IvcuStateMachine {

    private static final Map<IvcuStatus, Set<IvcuStatus>> TRANSITIONS = new EnumMap<>(IvcuStatus.class);

    static {
        TRANSITIONS.put(IvcuStatus.DRAFT, EnumSet.of(IvcuStatus.GENERATING, IvcuStatus.DEPRECATED));
        TRANSITIONS.put(IvcuStatus.GENERATING,
                EnumSet.of(IvcuStatus.VERIFYING, IvcuStatus.FAILED, IvcuStatus.DEPRECATED));
        TRANSITIONS.put(IvcuStatus.VERIFYING,
                EnumSet.of(IvcuStatus.VERIFIED, IvcuStatus.FAILED, IvcuStatus.DEPRECATED));
        TRANSITIONS.put(IvcuStatus.VERIFIED, EnumSet.of(IvcuStatus.DEPLOYED, IvcuStatus.DEPRECATED));
        TRANSITIONS.put(IvcuStatus.DEPLOYED, EnumSet.of(IvcuStatus.DEPRECATED));
        TRANSITIONS.put(IvcuStatus.FAILED, EnumSet.noneOf(IvcuStatus.class));
        TRANSITIONS.put(IvcuStatus.DEPRECATED, EnumSet.noneOf(IvcuStatus.class));
    }

    private final double confidenceThreshold;

    public IvcuStateMachine(double confidenceThreshold) {
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
        }
        this.confidenceThreshold = confidenceThreshold;
    }

    public boolean canTransition(IvcuStatus from, IvcuStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * @throws ValidationException if the move is not in the lifecycle graph, or if it enters
     *     VERIFIED without sufficient confidence
     */
    public Ivcu transition(Ivcu ivcu, IvcuStatus target, Instant now) {
        if (!canTransition(ivcu.status(), target)) {
            throw new ValidationException(
                    "invalid status transition from " + ivcu.status().value() + " to " + target.value(),
                    Map.of("from", ivcu.status().value(), "to", target.value()));
        }
        if (target == IvcuStatus.VERIFIED
                && (ivcu.confidenceScore() == null || ivcu.confidenceScore() < confidenceThreshold)) {
            throw new ValidationException("confidence below verification threshold",
                    Map.of("threshold", confidenceThreshold,
                            "confidence", ivcu.confidenceScore() == null ? "none" : ivcu.confidenceScore()));
        }
        return ivcu.withStatus(target, now);
    }

    /**
     * Records a verification outcome on a VERIFYING IVCU and moves it to VERIFIED when the run
     * passed with sufficient confidence, otherwise to FAILED.
     */
    public Ivcu applyVerification(Ivcu ivcu, VerificationOutcome outcome, Instant now) {
        if (ivcu.status() != IvcuStatus.VERIFYING) {
            throw new ValidationException("ivcu is not awaiting verification",
                    Map.of("status", ivcu.status().value()));
        }
        Ivcu scored = ivcu.withConfidence(outcome.confidence(), now);
        boolean verified = outcome.passed() && outcome.confidence() >= confidenceThreshold;
        return transition(scored, verified ? IvcuStatus.VERIFIED : IvcuStatus.FAILED, now);
    }

    /**
     * New DRAFT that retries a FAILED IVCU. The original stays FAILED.
     */
    public Ivcu retry(Ivcu failed, UUID newId, UUID requestedBy, Instant now) {
        if (failed.status() != IvcuStatus.FAILED) {
            throw new ValidationException("only failed ivcus can be retried",
                    Map.of("status", failed.status().value()));
        }
        return successorOf(failed, newId, failed.rawIntent(), failed.language(), requestedBy, now);
    }

    /**
     * Deprecates {@code prior} in favour of {@code successor}, which must list it as a parent
     * and carry a higher version.
     *
     * @return the deprecated prior IVCU
     */
    public Ivcu supersede(Ivcu prior, Ivcu successor, Instant now) {
        if (!successor.parentIds().contains(prior.id())) {
            throw new ValidationException("successor does not descend from the superseded ivcu");
        }
        if (successor.version() <= prior.version()) {
            throw new ValidationException("successor version must be greater than " + prior.version());
        }
        if (prior.status().isTerminal()) {
            throw new ValidationException("ivcu in status " + prior.status().value() + " cannot be superseded");
        }
        return transition(prior, IvcuStatus.DEPRECATED, now);
    }

    /** DRAFT one version above {@code parent}, listing it as its only parent. */
    public Ivcu successorOf(Ivcu parent, UUID newId, String rawIntent, String language, UUID createdBy,
                            Instant now) {
        return new Ivcu(newId, parent.projectId(), parent.version() + 1, rawIntent, null, language,
                IvcuStatus.DRAFT, null, null, createdBy, List.of(parent.id()), now, now);
    }

    public double confidenceThreshold() {
        return confidenceThreshold;
    }
}
