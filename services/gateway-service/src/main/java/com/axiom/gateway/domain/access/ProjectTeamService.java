package com.axiom.gateway.domain.access;

import com.axiom.gateway.domain.error.PersistenceException;
import com.axiom.gateway.domain.error.ResourceNotFoundException;
import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.security.AuthenticatedPrincipal;
import com.axiom.security.AuthorizationException;
import com.axiom.security.ProjectRole;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the explicit member list of a project.
 *
 * <p>Callers are expected to hold the team management permission already. On top of that a
 * caller may only grant, change or revoke roles up to their own effective role, and the
 * owner's implicit role can neither be overridden by a membership row nor removed.
 */
public class ProjectTeamService {

    private static final Logger log = LoggerFactory.getLogger(ProjectTeamService.class);

    private final ProjectDirectory directory;
    private final ProjectAccessAuthorizer authorizer;

    public ProjectTeamService(ProjectDirectory directory, ProjectAccessAuthorizer authorizer) {
        this.directory = directory;
        this.authorizer = authorizer;
    }

    public ProjectRef project(UUID projectId) {
        return directory.findProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("project", projectId));
    }

    public List<TeamMember> members(UUID projectId) {
        return directory.listMembers(projectId);
    }

    /**
     * Adds the user with the given email, or changes their role when already a member.
     *
     * @param roleLabel one of viewer, editor or admin
     * @throws ValidationException for any other role, or when the user owns the project
     * @throws ResourceNotFoundException when no user has the email
     * @throws AuthorizationException when the role outranks the caller's own
     */
    public TeamMember addMember(AuthenticatedPrincipal actor, UUID projectId, String email, String roleLabel) {
        ProjectRole role = ProjectRole.fromString(roleLabel)
                .filter(r -> r != ProjectRole.OWNER)
                .orElseThrow(() -> new ValidationException("role must be one of viewer, editor, admin",
                        Map.of("role", String.valueOf(roleLabel))));
        authorizer.requireRole(actor, projectId, role);

        UUID userId = directory.findUserIdByEmail(email)
                .orElseThrow(() -> new ResourceNotFoundException("user", email));
        if (userId.equals(project(projectId).ownerId())) {
            throw new ValidationException("the project owner's role cannot be changed");
        }

        directory.upsertMember(projectId, userId, role);
        log.info("User {} set role {} for user {} on project {}", actor.userId(), role.value(), userId, projectId);
        return directory.findMember(projectId, userId)
                .orElseThrow(() -> new PersistenceException("member " + userId + " vanished after save", null));
    }

    /**
     * A membership row with an unrecognised role label counts as a viewer here.
     *
     * @throws ValidationException when the user owns the project
     * @throws ResourceNotFoundException when the user is not an explicit member
     * @throws AuthorizationException when the member's role outranks the caller's own
     */
    public void removeMember(AuthenticatedPrincipal actor, UUID projectId, UUID userId) {
        if (userId.equals(project(projectId).ownerId())) {
            throw new ValidationException("the project owner cannot be removed");
        }
        String label = directory.findMemberRole(projectId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("project member", userId));
        authorizer.requireRole(actor, projectId, ProjectRole.fromString(label).orElse(ProjectRole.VIEWER));

        if (directory.deleteMember(projectId, userId)) {
            log.info("User {} removed user {} from project {}", actor.userId(), userId, projectId);
        }
    }
}
