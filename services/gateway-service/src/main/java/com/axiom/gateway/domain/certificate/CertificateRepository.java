package com.axiom.gateway.domain.certificate;

import com.axiom.gateway.domain.error.DuplicateCertificateException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Port for certificate storage. Rows are insert-only. */
public interface CertificateRepository {

    /**
     * @throws DuplicateCertificateException if a certificate exists for the same IVCU and proof type
     */
    void insert(ProofCertificate certificate);

    Optional<ProofCertificate> findById(UUID id);

    List<ProofCertificate> findByIvcuId(UUID ivcuId);
}
