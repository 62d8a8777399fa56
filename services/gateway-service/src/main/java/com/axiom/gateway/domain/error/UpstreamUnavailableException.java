package com.axiom.gateway.domain.error;

import java.util.Map;

/** A collaborator service (code generation, verification) failed or could not be reached. */
public class UpstreamUnavailableException extends AxiomException {

    private final String dependency;

    public UpstreamUnavailableException(String dependency, String message, Throwable cause) {
        super(ErrorCode.AI_SERVICE_UNAVAILABLE, message, Map.of("dependency", dependency), cause);
        this.dependency = dependency;
    }

    public String dependency() {
        return dependency;
    }
}
