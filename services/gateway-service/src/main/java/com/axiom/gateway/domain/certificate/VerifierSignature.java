package com.axiom.gateway.domain.certificate;

import java.time.Instant;

/** HMAC attestation of one verifier's result. */
public record VerifierSignature(String verifier, String signature, Instant timestamp) {
}
