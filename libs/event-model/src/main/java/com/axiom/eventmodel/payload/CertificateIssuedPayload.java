package com.axiom.eventmodel.payload;

/** Payload of {@code CertificateIssued}. */
public record CertificateIssuedPayload(String certificateId, String ivcuId, String proofType, String hashChain) {
}
