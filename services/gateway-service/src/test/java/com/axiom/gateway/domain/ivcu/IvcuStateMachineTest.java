package com.axiom.gateway.domain.ivcu;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.axiom.gateway.domain.error.ValidationException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("IvcuStateMachine")
class IvcuStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final IvcuStateMachine machine = new IvcuStateMachine(0.8);
    private final UUID projectId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    private Ivcu inStatus(IvcuStatus status, Double confidence) {
        return new Ivcu(UUID.randomUUID(), projectId, 1, "sort a list", "def f(): pass", "python", status,
                confidence, "model-a", userId, List.of(), NOW, NOW);
    }

    private static VerifierResult result(int tier, boolean passed, double confidence) {
        return new VerifierResult("verifier-" + tier, tier, passed, confidence, List.of());
    }

    @ParameterizedTest(name = "{0} -> {1} allowed={2}")
    @CsvSource({
            "DRAFT, GENERATING, true",
            "DRAFT, VERIFYING, false",
            "GENERATING, VERIFYING, true",
            "GENERATING, FAILED, true",
            "VERIFYING, VERIFIED, true",
            "VERIFIED, DEPLOYED, true",
            "VERIFIED, GENERATING, false",
            "DEPLOYED, DEPRECATED, true",
            "DEPLOYED, VERIFIED, false",
            "FAILED, DRAFT, false",
            "DEPRECATED, DRAFT, false"
    })
    @DisplayName("canTransition follows the lifecycle graph")
    void lifecycleGraph(IvcuStatus from, IvcuStatus to, boolean allowed) {
        assertThat(machine.canTransition(from, to)).isEqualTo(allowed);
    }

    @Test
    @DisplayName("should reject a move outside the graph with from/to details")
    void rejectsInvalidTransition() {
        assertThatThrownBy(() -> machine.transition(inStatus(IvcuStatus.DRAFT, null), IvcuStatus.DEPLOYED, NOW))
                .isInstanceOf(ValidationException.class)
                .hasMessage("invalid status transition from draft to deployed")
                .satisfies(e -> assertThat(((ValidationException) e).details())
                        .containsEntry("from", "draft")
                        .containsEntry("to", "deployed"));
    }

    @Test
    @DisplayName("should refuse VERIFIED below the confidence threshold")
    void verifiedNeedsConfidence() {
        assertThatThrownBy(() -> machine.transition(inStatus(IvcuStatus.VERIFYING, 0.5), IvcuStatus.VERIFIED, NOW))
                .isInstanceOf(ValidationException.class)
                .hasMessage("confidence below verification threshold");
        assertThat(machine.transition(inStatus(IvcuStatus.VERIFYING, 0.8), IvcuStatus.VERIFIED, NOW).status())
                .isEqualTo(IvcuStatus.VERIFIED);
    }

    @Nested
    @DisplayName("applyVerification")
    class ApplyVerification {

        @Test
        @DisplayName("should verify a passing, confident run and record its confidence")
        void passing() {
            var outcome = VerificationOutcome.aggregate(List.of(result(0, true, 0.9), result(1, true, 0.9)));

            Ivcu verified = machine.applyVerification(inStatus(IvcuStatus.VERIFYING, null), outcome, NOW);

            assertThat(verified.status()).isEqualTo(IvcuStatus.VERIFIED);
            assertThat(verified.confidenceScore()).isCloseTo(0.9, within(1e-9));
        }

        @Test
        @DisplayName("should fail a passing run below the threshold")
        void lowConfidence() {
            var outcome = VerificationOutcome.aggregate(List.of(result(1, true, 0.6)));

            assertThat(machine.applyVerification(inStatus(IvcuStatus.VERIFYING, null), outcome, NOW).status())
                    .isEqualTo(IvcuStatus.FAILED);
        }

        @Test
        @DisplayName("should only apply to VERIFYING units")
        void requiresVerifying() {
            var outcome = VerificationOutcome.aggregate(List.of(result(1, true, 0.9)));

            assertThatThrownBy(() -> machine.applyVerification(inStatus(IvcuStatus.DRAFT, null), outcome, NOW))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("lineage")
    class Lineage {

        @Test
        @DisplayName("retry should create a next-version draft of a failed unit")
        void retry() {
            Ivcu failed = inStatus(IvcuStatus.FAILED, 0.2);
            UUID newId = UUID.randomUUID();

            Ivcu retried = machine.retry(failed, newId, userId, NOW);

            assertThat(retried.id()).isEqualTo(newId);
            assertThat(retried.status()).isEqualTo(IvcuStatus.DRAFT);
            assertThat(retried.version()).isEqualTo(2);
            assertThat(retried.parentIds()).containsExactly(failed.id());
            assertThat(retried.rawIntent()).isEqualTo(failed.rawIntent());
            assertThat(retried.code()).isNull();
        }

        @Test
        @DisplayName("retry should refuse units that have not failed")
        void retryRequiresFailed() {
            assertThatThrownBy(() -> machine.retry(inStatus(IvcuStatus.VERIFIED, 0.9), UUID.randomUUID(), userId, NOW))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("supersede should deprecate the prior unit")
        void supersede() {
            Ivcu prior = inStatus(IvcuStatus.DEPLOYED, 0.95);
            Ivcu successor = machine.successorOf(prior, UUID.randomUUID(), "sort faster", "python", userId, NOW);

            Ivcu deprecated = machine.supersede(prior, successor, NOW);

            assertThat(deprecated.status()).isEqualTo(IvcuStatus.DEPRECATED);
            assertThat(successor.version()).isEqualTo(prior.version() + 1);
        }

        @Test
        @DisplayName("supersede should refuse a successor that does not descend from the prior")
        void supersedeNeedsLineage() {
            Ivcu prior = inStatus(IvcuStatus.VERIFIED, 0.9);
            Ivcu unrelated = machine.successorOf(inStatus(IvcuStatus.VERIFIED, 0.9), UUID.randomUUID(), "x",
                    "python", userId, NOW);

            assertThatThrownBy(() -> machine.supersede(prior, unrelated, NOW))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("supersede should refuse terminal units")
        void supersedeTerminal() {
            Ivcu prior = inStatus(IvcuStatus.FAILED, 0.1);
            Ivcu successor = machine.successorOf(prior, UUID.randomUUID(), "x", "python", userId, NOW);

            assertThatThrownBy(() -> machine.supersede(prior, successor, NOW))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("cannot be superseded");
        }
    }

    @Test
    @DisplayName("should reject a threshold outside [0, 1]")
    void thresholdRange() {
        assertThatThrownBy(() -> new IvcuStateMachine(1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
