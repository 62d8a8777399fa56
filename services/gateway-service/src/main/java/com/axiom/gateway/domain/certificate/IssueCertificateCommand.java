package com.axiom.gateway.domain.certificate;

import com.axiom.gateway.domain.ivcu.VerifierResult;
import java.util.List;
import java.util.UUID;

/**
 * Request to certify a verified IVCU.
 *
 * @param intentId intent the code was generated for; defaults to the IVCU id when null
 */
public record IssueCertificateCommand(
        UUID ivcuId,
        ProofType proofType,
        UUID intentId,
        List<VerifierResult> verifierResults,
        List<FormalAssertion> assertions,
        byte[] proofData) {

    public IssueCertificateCommand {
        verifierResults = verifierResults == null ? List.of() : List.copyOf(verifierResults);
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
        proofData = proofData == null ? new byte[0] : proofData.clone();
    }
}
