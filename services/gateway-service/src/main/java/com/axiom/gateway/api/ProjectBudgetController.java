package com.axiom.gateway.api;

import com.axiom.gateway.api.dto.BudgetResponse;
import com.axiom.gateway.api.dto.UsageLogResponse;
import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.AdmissionRequest;
import com.axiom.gateway.domain.admission.GatedOperation;
import com.axiom.gateway.domain.budget.BudgetGuard;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Budget standing and usage history for a project; requires the cost view permission. */
@RestController
@RequestMapping("/api/v1/projects/{projectId}")
public class ProjectBudgetController {

    static final int MAX_USAGE_ENTRIES = 500;

    private final AdmissionController admissions;
    private final BudgetGuard budgetGuard;

    public ProjectBudgetController(AdmissionController admissions, BudgetGuard budgetGuard) {
        this.admissions = admissions;
        this.budgetGuard = budgetGuard;
    }

    @GetMapping("/budget")
    public ResponseEntity<BudgetResponse> budget(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID projectId,
            HttpServletRequest request) {
        Admission admission = admit(authorization, projectId, request);
        return Responses.ok(admission, BudgetResponse.from(budgetGuard.summary(projectId)));
    }

    @GetMapping("/usage")
    public ResponseEntity<List<UsageLogResponse>> usage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID projectId,
            @RequestParam(defaultValue = "50") int limit,
            HttpServletRequest request) {
        Admission admission = admit(authorization, projectId, request);
        List<UsageLogResponse> entries = budgetGuard.usageHistory(projectId, Math.min(limit, MAX_USAGE_ENTRIES))
                .stream()
                .map(UsageLogResponse::from)
                .toList();
        return Responses.ok(admission, entries);
    }

    private Admission admit(String authorization, UUID projectId, HttpServletRequest request) {
        return admissions.admit(AdmissionRequest.forProject(GatedOperation.VIEW_COST, authorization,
                request.getRemoteAddr(), projectId));
    }
}
