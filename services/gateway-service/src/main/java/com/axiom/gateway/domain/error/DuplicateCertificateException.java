package com.axiom.gateway.domain.error;

/** A certificate already exists for the (IVCU, proof type) pair. Existing rows are never overwritten. */
public class DuplicateCertificateException extends PersistenceException {

    public DuplicateCertificateException(String ivcuId, String proofType, Throwable cause) {
        super(ErrorCode.CONFLICT,
                "certificate already exists for ivcu " + ivcuId + " and proof type " + proofType, cause);
    }
}
