package com.axiom.gateway.domain.ivcu;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VerificationOutcome")
class VerificationOutcomeTest {

    private static VerifierResult result(int tier, boolean passed, double confidence) {
        return new VerifierResult("tier-" + tier, tier, passed, confidence, List.of());
    }

    @Test
    @DisplayName("should weight confidence by tier")
    void weightedConfidence() {
        // (0.5 * 1.0 + 1.0 * 0.8 + 2.0 * 0.5) / 3.5
        var outcome = VerificationOutcome.aggregate(List.of(
                result(0, true, 1.0), result(1, true, 0.8), result(3, true, 0.5)));

        assertThat(outcome.passed()).isTrue();
        assertThat(outcome.confidence()).isCloseTo(2.3 / 3.5, within(1e-9));
    }

    @Test
    @DisplayName("should fail when any present tier failed")
    void anyFailureFails() {
        var outcome = VerificationOutcome.aggregate(List.of(result(1, true, 0.9), result(2, false, 0.9)));

        assertThat(outcome.passed()).isFalse();
    }

    @Test
    @DisplayName("should fail without a tier 1 result")
    void requiresTierOne() {
        var outcome = VerificationOutcome.aggregate(List.of(result(0, true, 1.0), result(2, true, 1.0)));

        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.confidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat no results as a failed run with zero confidence")
    void empty() {
        assertThat(VerificationOutcome.aggregate(List.of()))
                .satisfies(o -> {
                    assertThat(o.passed()).isFalse();
                    assertThat(o.confidence()).isZero();
                });
        assertThat(VerificationOutcome.aggregate(null).passed()).isFalse();
    }

    @Test
    @DisplayName("verifier results should reject out-of-range tier and confidence")
    void resultValidation() {
        assertThatThrownBy(() -> result(4, true, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> result(1, true, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
