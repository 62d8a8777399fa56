package com.axiom.gateway.api;

import com.axiom.gateway.api.dto.GenerationCallbackRequest;
import com.axiom.gateway.api.dto.IvcuResponse;
import com.axiom.gateway.api.dto.StartGenerationRequest;
import com.axiom.gateway.config.BudgetProperties;
import com.axiom.gateway.config.IvcuProperties;
import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.AdmissionRequest;
import com.axiom.gateway.domain.admission.GatedOperation;
import com.axiom.gateway.domain.ivcu.Ivcu;
import com.axiom.gateway.domain.ivcu.IvcuService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts code generation for an intent and accepts completion callbacks from the workflow engine.
 */
@RestController
@RequestMapping("/api/v1/generation")
public class GenerationController {

    private final AdmissionController admissions;
    private final IvcuService ivcus;
    private final BudgetProperties budget;
    private final IvcuProperties ivcuProperties;

    public GenerationController(AdmissionController admissions, IvcuService ivcus, BudgetProperties budget,
                                IvcuProperties ivcuProperties) {
        this.admissions = admissions;
        this.ivcus = ivcus;
        this.budget = budget;
        this.ivcuProperties = ivcuProperties;
    }

    @PostMapping("/start")
    public ResponseEntity<IvcuResponse> start(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody StartGenerationRequest body,
            HttpServletRequest request) {
        Admission admission = admissions.admit(AdmissionRequest.forProject(GatedOperation.START_GENERATION,
                authorization, request.getRemoteAddr(), body.projectId(), budget.generationEstimate()));
        String language = body.language() != null && !body.language().isBlank()
                ? body.language()
                : ivcuProperties.defaultLanguage();
        List<String> constraints = body.constraints() != null ? body.constraints() : List.of();
        Ivcu ivcu = ivcus.startGeneration(admission, body.intent(), constraints, language);
        return Responses.created(admission, IvcuResponse.from(ivcu));
    }

    @PostMapping("/{ivcuId}/cancel")
    public ResponseEntity<IvcuResponse> cancel(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID ivcuId,
            HttpServletRequest request) {
        Admission admission = admissions.admit(AdmissionRequest.forResource(GatedOperation.TRANSITION_IVCU,
                authorization, request.getRemoteAddr(), () -> ivcus.projectOf(ivcuId)));
        return Responses.ok(admission, IvcuResponse.from(ivcus.cancelGeneration(ivcuId)));
    }

    @PostMapping("/{ivcuId}/callback")
    public ResponseEntity<IvcuResponse> callback(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID ivcuId,
            @Valid @RequestBody GenerationCallbackRequest body,
            HttpServletRequest request) {
        Admission admission = admissions.admit(AdmissionRequest.forResource(GatedOperation.TRANSITION_IVCU,
                authorization, request.getRemoteAddr(), () -> ivcus.projectOf(ivcuId)));
        return Responses.ok(admission, IvcuResponse.from(ivcus.applyCallback(ivcuId, body.toCallback())));
    }
}
