package com.axiom.gateway.domain.error;

import java.util.Map;

/** The addressed project, IVCU or certificate does not exist. */
public class ResourceNotFoundException extends AxiomException {

    public ResourceNotFoundException(String resource, Object id) {
        super(ErrorCode.NOT_FOUND, resource + " not found", Map.of("id", String.valueOf(id)), null);
    }
}
