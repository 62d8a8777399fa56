package com.axiom.gateway.api;

import com.axiom.gateway.api.dto.CertificateResponse;
import com.axiom.gateway.api.dto.CertificateVerificationResponse;
import com.axiom.gateway.api.dto.IssueCertificateRequest;
import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.AdmissionRequest;
import com.axiom.gateway.domain.admission.GatedOperation;
import com.axiom.gateway.domain.certificate.CertificateIssuer;
import com.axiom.gateway.domain.certificate.ProofCertificate;
import com.axiom.gateway.domain.ivcu.IvcuService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues and reads proof certificates. Integrity verification is public so third parties can
 * check a certificate without an account.
 */
@RestController
@RequestMapping("/api/v1/certificates")
public class CertificateController {

    private final AdmissionController admissions;
    private final CertificateIssuer issuer;
    private final IvcuService ivcus;

    public CertificateController(AdmissionController admissions, CertificateIssuer issuer, IvcuService ivcus) {
        this.admissions = admissions;
        this.issuer = issuer;
        this.ivcus = ivcus;
    }

    @PostMapping
    public ResponseEntity<CertificateResponse> issue(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody IssueCertificateRequest body,
            HttpServletRequest request) {
        Admission admission = admissions.admit(AdmissionRequest.forResource(GatedOperation.ISSUE_CERTIFICATE,
                authorization, request.getRemoteAddr(), () -> ivcus.projectOf(body.ivcuId())));
        return Responses.created(admission, CertificateResponse.from(issuer.issue(body.toCommand())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CertificateResponse> get(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id,
            HttpServletRequest request) {
        Admission admission = admissions.admit(AdmissionRequest.forResource(GatedOperation.VIEW_CERTIFICATE,
                authorization, request.getRemoteAddr(), () -> issuer.projectOf(id)));
        return Responses.ok(admission, CertificateResponse.from(issuer.get(id)));
    }

    @GetMapping("/{id}/verify")
    public ResponseEntity<CertificateVerificationResponse> verify(
            @PathVariable UUID id,
            HttpServletRequest request) {
        Admission admission = admissions.admit(AdmissionRequest.unscoped(GatedOperation.VERIFY_CERTIFICATE,
                null, request.getRemoteAddr()));
        ProofCertificate certificate = issuer.verify(id);
        return Responses.ok(admission, new CertificateVerificationResponse(certificate.id(),
                certificate.ivcuId(), true, certificate.hashChain()));
    }
}
