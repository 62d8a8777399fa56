package com.axiom.gateway.api;

import com.axiom.gateway.api.dto.IvcuResponse;
import com.axiom.gateway.api.dto.SupersedeRequest;
import com.axiom.gateway.api.dto.TransitionRequest;
import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.AdmissionRequest;
import com.axiom.gateway.domain.admission.GatedOperation;
import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.gateway.domain.ivcu.IvcuService;
import com.axiom.gateway.domain.ivcu.IvcuStatus;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.Map;
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
 * Reads IVCUs and drives their lifecycle: explicit transitions, retries of failed units and
 * superseding with a new version.
 */
@RestController
@RequestMapping("/api/v1/ivcus")
public class IvcuController {

    private final AdmissionController admissions;
    private final IvcuService ivcus;

    public IvcuController(AdmissionController admissions, IvcuService ivcus) {
        this.admissions = admissions;
        this.ivcus = ivcus;
    }

    @GetMapping("/{id}")
    public ResponseEntity<IvcuResponse> get(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id,
            HttpServletRequest request) {
        Admission admission = admit(GatedOperation.READ_IVCU, authorization, id, request);
        return Responses.ok(admission, IvcuResponse.from(ivcus.get(id)));
    }

    @PostMapping("/{id}/transition")
    public ResponseEntity<IvcuResponse> transition(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id,
            @Valid @RequestBody TransitionRequest body,
            HttpServletRequest request) {
        Admission admission = admit(GatedOperation.TRANSITION_IVCU, authorization, id, request);
        IvcuStatus target = IvcuStatus.fromValue(body.status())
                .orElseThrow(() -> new ValidationException("unknown status", Map.of("status", body.status())));
        return Responses.ok(admission, IvcuResponse.from(ivcus.transition(id, target)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<IvcuResponse> retry(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id,
            HttpServletRequest request) {
        Admission admission = admit(GatedOperation.TRANSITION_IVCU, authorization, id, request);
        return Responses.created(admission,
                IvcuResponse.from(ivcus.retry(id, admission.principal().userId())));
    }

    @PostMapping("/{id}/supersede")
    public ResponseEntity<IvcuResponse> supersede(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id,
            @Valid @RequestBody(required = false) SupersedeRequest body,
            HttpServletRequest request) {
        Admission admission = admit(GatedOperation.TRANSITION_IVCU, authorization, id, request);
        String rawIntent = body != null ? body.rawIntent() : null;
        String language = body != null ? body.language() : null;
        return Responses.created(admission,
                IvcuResponse.from(ivcus.supersede(id, admission.principal().userId(), rawIntent, language)));
    }

    private Admission admit(GatedOperation operation, String authorization, UUID ivcuId,
                            HttpServletRequest request) {
        return admissions.admit(AdmissionRequest.forResource(operation, authorization, request.getRemoteAddr(),
                () -> ivcus.projectOf(ivcuId)));
    }
}
