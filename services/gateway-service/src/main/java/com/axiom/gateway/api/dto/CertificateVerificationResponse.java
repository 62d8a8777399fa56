package com.axiom.gateway.api.dto;

import java.util.UUID;

/** Result of a successful integrity check. Failed checks are reported as errors. */
public record CertificateVerificationResponse(UUID certificateId, UUID ivcuId, boolean valid, String hashChain) {
}
