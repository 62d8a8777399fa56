package com.axiom.gateway.domain.certificate;

import com.axiom.gateway.domain.error.AxiomException;
import com.axiom.gateway.domain.error.ErrorCode;
import java.util.Map;
import java.util.UUID;

/** A stored certificate no longer matches its own hash chain or signature. */
public class IntegrityViolationException extends AxiomException {

    public enum Reason {
        HASH_CHAIN_MISMATCH,
        SIGNATURE_MISMATCH
    }

    private final Reason reason;

    public IntegrityViolationException(UUID certificateId, Reason reason) {
        super(ErrorCode.INTEGRITY_VIOLATION, "certificate integrity check failed",
                Map.of("certificate_id", String.valueOf(certificateId), "reason", reason.name()), null);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
