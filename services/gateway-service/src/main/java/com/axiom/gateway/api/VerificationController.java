package com.axiom.gateway.api;

import com.axiom.gateway.api.dto.VerificationResponse;
import com.axiom.gateway.api.dto.VerifyRequest;
import com.axiom.gateway.config.BudgetProperties;
import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.AdmissionRequest;
import com.axiom.gateway.domain.admission.GatedOperation;
import com.axiom.gateway.domain.ivcu.IvcuService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/verification")
public class VerificationController {

    private final AdmissionController admissions;
    private final IvcuService ivcus;
    private final BudgetProperties budget;

    public VerificationController(AdmissionController admissions, IvcuService ivcus, BudgetProperties budget) {
        this.admissions = admissions;
        this.ivcus = ivcus;
        this.budget = budget;
    }

    /** Runs the verifier tiers against a VERIFYING unit's code and applies the aggregate result. */
    @PostMapping("/verify")
    public ResponseEntity<VerificationResponse> verify(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody VerifyRequest body,
            HttpServletRequest request) {
        Admission admission = admissions.admit(new AdmissionRequest(GatedOperation.RUN_VERIFICATION,
                authorization, request.getRemoteAddr(), () -> ivcus.projectOf(body.ivcuId()),
                budget.verificationEstimate()));
        return Responses.ok(admission, VerificationResponse.from(ivcus.verify(admission, body.ivcuId())));
    }
}
