package com.axiom.gateway.domain.access;

import com.axiom.gateway.domain.error.ResourceNotFoundException;
import com.axiom.security.AuthenticatedPrincipal;
import com.axiom.security.AuthorizationException;
import com.axiom.security.Permission;
import com.axiom.security.ProjectRole;
import com.axiom.security.RoleChecker;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a principal's effective role on a project and checks it against a required
 * permission or role.
 *
 * <p>An explicit membership row wins. Without one, the project owner gets the implicit
 * {@link ProjectRole#OWNER} role and everyone else is denied. A membership row carrying an
 * unknown role label grants nothing.
 */
public class ProjectAccessAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(ProjectAccessAuthorizer.class);

    private final ProjectDirectory directory;

    public ProjectAccessAuthorizer(ProjectDirectory directory) {
        this.directory = directory;
    }

    /**
     * @return the effective role
     * @throws ResourceNotFoundException if the project does not exist
     * @throws AuthorizationException if the principal has no role or the role lacks the permission
     */
    public ProjectRole authorize(AuthenticatedPrincipal principal, UUID projectId, Permission permission) {
        ProjectRole role = effectiveRole(principal, projectId);
        if (!RoleChecker.hasPermission(role, permission)) {
            log.debug("User {} with role {} lacks {} on project {}",
                    principal.userId(), role.value(), permission.value(), projectId);
            throw AuthorizationException.insufficientPermissions();
        }
        return role;
    }

    /** Same resolution as {@link #authorize}, checked against a minimum role instead. */
    public ProjectRole requireRole(AuthenticatedPrincipal principal, UUID projectId, ProjectRole required) {
        ProjectRole role = effectiveRole(principal, projectId);
        if (!RoleChecker.hasRole(role, required)) {
            throw AuthorizationException.insufficientPermissions();
        }
        return role;
    }

    private ProjectRole effectiveRole(AuthenticatedPrincipal principal, UUID projectId) {
        Optional<String> memberRole = directory.findMemberRole(projectId, principal.userId());
        if (memberRole.isPresent()) {
            return ProjectRole.fromString(memberRole.get())
                    .orElseThrow(() -> {
                        log.warn("Unknown role label '{}' for user {} on project {}",
                                memberRole.get(), principal.userId(), projectId);
                        return AuthorizationException.insufficientPermissions();
                    });
        }

        ProjectRef project = directory.findProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("project", projectId));
        if (principal.userId().equals(project.ownerId())) {
            return ProjectRole.OWNER;
        }
        throw AuthorizationException.accessDenied();
    }
}
