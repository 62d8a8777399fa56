package com.axiom.gateway.domain.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.axiom.gateway.domain.error.ResourceNotFoundException;
import com.axiom.security.AuthenticatedPrincipal;
import com.axiom.security.AuthorizationException;
import com.axiom.security.Permission;
import com.axiom.security.ProjectRole;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ProjectAccessAuthorizer")
class ProjectAccessAuthorizerTest {

    private final UUID projectId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();
    private final AuthenticatedPrincipal principal = new AuthenticatedPrincipal(userId, "dev@example.com", "developer");

    private ProjectDirectory directory;
    private ProjectAccessAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        directory = mock(ProjectDirectory.class);
        authorizer = new ProjectAccessAuthorizer(directory);
    }

    @Nested
    @DisplayName("with a membership row")
    class WithMembership {

        @Test
        @DisplayName("should return the member role when it grants the permission")
        void grantsMemberRole() {
            when(directory.findMemberRole(projectId, userId)).thenReturn(Optional.of("editor"));

            assertThat(authorizer.authorize(principal, projectId, Permission.PROJECT_EDIT))
                    .isEqualTo(ProjectRole.EDITOR);
            verify(directory, never()).findProject(projectId);
        }

        @Test
        @DisplayName("should deny a viewer editing with insufficient permissions")
        void viewerCannotEdit() {
            when(directory.findMemberRole(projectId, userId)).thenReturn(Optional.of("viewer"));

            assertThatThrownBy(() -> authorizer.authorize(principal, projectId, Permission.PROJECT_EDIT))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessage(AuthorizationException.INSUFFICIENT_PERMISSIONS);
        }

        @Test
        @DisplayName("should treat an unknown role label as insufficient")
        void unknownLabel() {
            when(directory.findMemberRole(projectId, userId)).thenReturn(Optional.of("superuser"));

            assertThatThrownBy(() -> authorizer.authorize(principal, projectId, Permission.PROJECT_READ))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessage(AuthorizationException.INSUFFICIENT_PERMISSIONS);
        }

        @Test
        @DisplayName("should prefer the membership row over ownership")
        void membershipWinsOverOwnership() {
            when(directory.findMemberRole(projectId, userId)).thenReturn(Optional.of("viewer"));
            when(directory.findProject(projectId)).thenReturn(Optional.of(new ProjectRef(projectId, "p", userId)));

            assertThatThrownBy(() -> authorizer.authorize(principal, projectId, Permission.COST_VIEW))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Nested
    @DisplayName("without a membership row")
    class WithoutMembership {

        @BeforeEach
        void noMembership() {
            when(directory.findMemberRole(projectId, userId)).thenReturn(Optional.empty());
        }

        @Test
        @DisplayName("should grant the owner every permission")
        void ownerHasAllPermissions() {
            when(directory.findProject(projectId)).thenReturn(Optional.of(new ProjectRef(projectId, "p", userId)));

            assertThat(authorizer.authorize(principal, projectId, Permission.BUDGET_APPROVE))
                    .isEqualTo(ProjectRole.OWNER);
        }

        @Test
        @DisplayName("should deny access to a stranger")
        void strangerDenied() {
            when(directory.findProject(projectId))
                    .thenReturn(Optional.of(new ProjectRef(projectId, "p", UUID.randomUUID())));

            assertThatThrownBy(() -> authorizer.authorize(principal, projectId, Permission.PROJECT_READ))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessage(AuthorizationException.ACCESS_DENIED);
        }

        @Test
        @DisplayName("should report a missing project as not found")
        void missingProject() {
            when(directory.findProject(projectId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> authorizer.authorize(principal, projectId, Permission.PROJECT_READ))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("requireRole should compare against the minimum role")
    void requireRole() {
        when(directory.findMemberRole(projectId, userId)).thenReturn(Optional.of("admin"));

        assertThat(authorizer.requireRole(principal, projectId, ProjectRole.EDITOR)).isEqualTo(ProjectRole.ADMIN);
        assertThatThrownBy(() -> authorizer.requireRole(principal, projectId, ProjectRole.OWNER))
                .isInstanceOf(AuthorizationException.class);
    }
}
