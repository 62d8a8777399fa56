package com.axiom.gateway.domain.ivcu;

import com.axiom.gateway.domain.error.UpstreamUnavailableException;

/**
 * Port to the verification service.
 */
public interface VerificationClient {

    /**
     * @throws UpstreamUnavailableException if the service fails or cannot be reached
     */
    VerificationReport verify(String code, String language);
}
