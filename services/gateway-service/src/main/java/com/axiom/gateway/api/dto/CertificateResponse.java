package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.certificate.FormalAssertion;
import com.axiom.gateway.domain.certificate.ProofCertificate;
import com.axiom.gateway.domain.certificate.VerifierSignature;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record CertificateResponse(
        UUID id,
        UUID ivcuId,
        String proofType,
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

    public static CertificateResponse from(ProofCertificate certificate) {
        return new CertificateResponse(certificate.id(), certificate.ivcuId(), certificate.proofType().value(),
                certificate.verifierVersion(), certificate.timestamp(), certificate.intentId(),
                certificate.astHash(), certificate.codeHash(), certificate.verifierSignatures(),
                certificate.assertions(), certificate.proofData(), certificate.hashChain(),
                certificate.signature(), certificate.createdAt());
    }
}
