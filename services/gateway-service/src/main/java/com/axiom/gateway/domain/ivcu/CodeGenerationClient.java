package com.axiom.gateway.domain.ivcu;

import com.axiom.gateway.domain.error.UpstreamUnavailableException;

/**
 * Port to the AI code generation service.
 */
public interface CodeGenerationClient {

    /**
     * @throws UpstreamUnavailableException if the service fails or cannot be reached
     */
    GeneratedCode generate(GenerationRequest request);
}
