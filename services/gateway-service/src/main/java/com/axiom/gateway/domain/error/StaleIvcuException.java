package com.axiom.gateway.domain.error;

import java.util.Map;

/**
 * The IVCU left the status a transition was computed from before it could be written, because
 * a concurrent request moved it first. Nothing was stored.
 */
public class StaleIvcuException extends AxiomException {

    public StaleIvcuException(Object ivcuId, String expectedStatus) {
        super(ErrorCode.CONFLICT, "ivcu changed concurrently, it is no longer " + expectedStatus,
                Map.of("id", String.valueOf(ivcuId), "expected_status", expectedStatus), null);
    }
}
