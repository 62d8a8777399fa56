package com.axiom.gateway.domain.certificate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Tamper-evident record binding verified code to its structural hash, intent and verifier
 * attestations. {@code hashChain} covers code hash, AST hash, intent id and timestamp;
 * {@code signature} is the service HMAC over the chain. Certificates are never modified
 * after they are stored.
 */
public record ProofCertificate(
        UUID id,
        UUID ivcuId,
        ProofType proofType,
        String verifierVersion,
        Instant timestamp,
        UUID intentId,
        String astHash,
        String codeHash,
        List<VerifierSignature> verifierSignatures,
        List<FormalAssertion> assertions,
        byte[] proofData,
        String hashChain,
        String signature,
        Instant createdAt) {

    public ProofCertificate {
        verifierSignatures = verifierSignatures == null ? List.of() : List.copyOf(verifierSignatures);
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
        proofData = proofData == null ? new byte[0] : proofData.clone();
    }

    @Override
    public byte[] proofData() {
        return proofData.clone();
    }
}
