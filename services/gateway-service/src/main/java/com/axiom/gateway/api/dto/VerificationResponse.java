package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.ivcu.VerificationRun;
import com.axiom.gateway.domain.ivcu.VerifierResult;
import java.util.List;

public record VerificationResponse(IvcuResponse ivcu, boolean passed, double confidence,
                                   List<VerifierResult> verifierResults) {

    public static VerificationResponse from(VerificationRun run) {
        return new VerificationResponse(IvcuResponse.from(run.ivcu()), run.outcome().passed(),
                run.outcome().confidence(), run.outcome().results());
    }
}
