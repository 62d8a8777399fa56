package com.axiom.gateway.api;

import com.axiom.gateway.api.dto.AddMemberRequest;
import com.axiom.gateway.api.dto.TeamMemberResponse;
import com.axiom.gateway.api.dto.TeamResponse;
import com.axiom.gateway.domain.access.ProjectRef;
import com.axiom.gateway.domain.access.ProjectTeamService;
import com.axiom.gateway.domain.admission.Admission;
import com.axiom.gateway.domain.admission.AdmissionController;
import com.axiom.gateway.domain.admission.AdmissionRequest;
import com.axiom.gateway.domain.admission.GatedOperation;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Project team: any member may list it, changing it requires the team management permission.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/team")
public class ProjectTeamController {

    private final AdmissionController admissions;
    private final ProjectTeamService team;

    public ProjectTeamController(AdmissionController admissions, ProjectTeamService team) {
        this.admissions = admissions;
        this.team = team;
    }

    @GetMapping
    public ResponseEntity<TeamResponse> list(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID projectId,
            HttpServletRequest request) {
        Admission admission = admit(GatedOperation.LIST_MEMBERS, authorization, projectId, request);
        ProjectRef project = team.project(projectId);
        List<TeamMemberResponse> members = team.members(projectId).stream()
                .map(TeamMemberResponse::from)
                .toList();
        return Responses.ok(admission, new TeamResponse(project.id(), project.ownerId(), members));
    }

    @PostMapping
    public ResponseEntity<TeamMemberResponse> add(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID projectId,
            @Valid @RequestBody AddMemberRequest body,
            HttpServletRequest request) {
        Admission admission = admit(GatedOperation.MANAGE_TEAM, authorization, projectId, request);
        return Responses.ok(admission, TeamMemberResponse.from(
                team.addMember(admission.principal(), projectId, body.email(), body.role())));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> remove(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID projectId,
            @PathVariable UUID userId,
            HttpServletRequest request) {
        Admission admission = admit(GatedOperation.MANAGE_TEAM, authorization, projectId, request);
        team.removeMember(admission.principal(), projectId, userId);
        return Responses.status(HttpStatus.NO_CONTENT, admission, null);
    }

    private Admission admit(GatedOperation operation, String authorization, UUID projectId,
                            HttpServletRequest request) {
        return admissions.admit(AdmissionRequest.forProject(operation, authorization, request.getRemoteAddr(),
                projectId));
    }
}
