package com.axiom.gateway.domain.ivcu;

/** The IVCU after a verification run, with the aggregated outcome. */
public record VerificationRun(Ivcu ivcu, VerificationOutcome outcome) {
}
