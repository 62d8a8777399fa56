package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.certificate.FormalAssertion;
import com.axiom.gateway.domain.certificate.IssueCertificateCommand;
import com.axiom.gateway.domain.certificate.ProofType;
import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.gateway.domain.ivcu.VerifierResult;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Body of {@code POST /api/v1/certificates}. {@code proofData} travels as base64.
 *
 * @param intentId intent the code was generated for; the IVCU id is used when absent
 */
public record IssueCertificateRequest(
        @NotNull UUID ivcuId,
        @NotBlank String proofType,
        UUID intentId,
        List<VerifierResult> verifierResults,
        List<FormalAssertion> assertions,
        byte[] proofData) {

    public IssueCertificateCommand toCommand() {
        ProofType type = ProofType.fromValue(proofType)
                .orElseThrow(() -> new ValidationException("unknown proof type", Map.of("proof_type", proofType)));
        return new IssueCertificateCommand(ivcuId, type, intentId, verifierResults, assertions, proofData);
    }
}
