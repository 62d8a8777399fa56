package com.axiom.gateway.domain.certificate;

import com.axiom.eventmodel.EntityType;
import com.axiom.eventmodel.EventEntity;
import com.axiom.eventmodel.EventType;
import com.axiom.eventmodel.payload.CertificateIssuedPayload;
import com.axiom.gateway.domain.error.ResourceNotFoundException;
import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.gateway.domain.event.DomainEvents;
import com.axiom.gateway.domain.event.EventPublisher;
import com.axiom.gateway.domain.ivcu.Ivcu;
import com.axiom.gateway.domain.ivcu.IvcuRepository;
import com.axiom.gateway.domain.ivcu.IvcuStatus;
import com.axiom.observability.MetricFactory;
import com.axiom.observability.SpanHelper;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, looks up and checks proof certificates for verified IVCUs.
 */
public class CertificateIssuer {

    private static final Logger log = LoggerFactory.getLogger(CertificateIssuer.class);

    private final IvcuRepository ivcus;
    private final CertificateService certificateService;
    private final CertificateRepository certificates;
    private final EventPublisher events;
    private final SpanHelper spans;
    private final Clock clock;
    private final Counter issued;

    public CertificateIssuer(IvcuRepository ivcus, CertificateService certificateService,
                             CertificateRepository certificates, EventPublisher events, MetricFactory metrics,
                             SpanHelper spans, Clock clock) {
        this.ivcus = ivcus;
        this.certificateService = certificateService;
        this.certificates = certificates;
        this.events = events;
        this.spans = spans;
        this.clock = clock;
        this.issued = metrics.counter("axiom.certificates.issued", "Proof certificates issued");
    }

    /**
     * Generates, stores and announces a certificate. Only VERIFIED IVCUs can be certified, and
     * only once per proof type.
     *
     * @throws ResourceNotFoundException if the IVCU does not exist
     * @throws ValidationException if the IVCU is not VERIFIED or has no code
     * @throws com.axiom.gateway.domain.error.DuplicateCertificateException if one already exists
     */
    public ProofCertificate issue(IssueCertificateCommand command) {
        return spans.inSpan("certificate.issue",
                Map.of("ivcu.id", command.ivcuId().toString(), "proof.type", command.proofType().value()),
                () -> doIssue(command));
    }

    private ProofCertificate doIssue(IssueCertificateCommand command) {
        Ivcu ivcu = ivcus.findById(command.ivcuId())
                .orElseThrow(() -> new ResourceNotFoundException("ivcu", command.ivcuId()));
        if (ivcu.status() != IvcuStatus.VERIFIED) {
            throw new ValidationException("only verified ivcus can be certified",
                    Map.of("status", ivcu.status().value()));
        }
        if (ivcu.code() == null) {
            throw new ValidationException("verified ivcu has no code");
        }

        UUID intentId = command.intentId() != null ? command.intentId() : ivcu.id();
        ProofCertificate certificate = certificateService.generateCertificate(ivcu.id(), intentId, ivcu.code(),
                command.proofType(), command.verifierResults(), command.assertions(), command.proofData());
        certificates.insert(certificate);
        issued.increment();
        log.info("Issued {} certificate {} for ivcu {}", command.proofType().value(), certificate.id(), ivcu.id());

        events.publish(DomainEvents.of(EventType.CERTIFICATE_ISSUED, ivcu.projectId(),
                EventEntity.of(EntityType.PROOF_CERTIFICATE, certificate.id().toString(), 0),
                new CertificateIssuedPayload(certificate.id().toString(), ivcu.id().toString(),
                        command.proofType().value(), certificate.hashChain()),
                clock));
        return certificate;
    }

    public ProofCertificate get(UUID certificateId) {
        return certificates.findById(certificateId)
                .orElseThrow(() -> new ResourceNotFoundException("certificate", certificateId));
    }

    public List<ProofCertificate> forIvcu(UUID ivcuId) {
        return certificates.findByIvcuId(ivcuId);
    }

    /** Project owning the certified IVCU, used to scope admission for certificate requests. */
    public UUID projectOf(UUID certificateId) {
        UUID ivcuId = get(certificateId).ivcuId();
        return ivcus.findById(ivcuId)
                .map(Ivcu::projectId)
                .orElseThrow(() -> new ResourceNotFoundException("ivcu", ivcuId));
    }

    /**
     * Loads the certificate and checks its integrity.
     *
     * @throws IntegrityViolationException if the stored fields no longer match
     */
    public ProofCertificate verify(UUID certificateId) {
        ProofCertificate certificate = get(certificateId);
        certificateService.verifyIntegrity(certificate);
        return certificate;
    }
}
