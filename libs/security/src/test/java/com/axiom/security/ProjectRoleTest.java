package com.axiom.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProjectRole")
class ProjectRoleTest {

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @ParameterizedTest(name = "{0} at least {1} = {2}")
        @CsvSource({
                "VIEWER, EDITOR, false",
                "VIEWER, VIEWER, true",
                "EDITOR, VIEWER, true",
                "EDITOR, ADMIN, false",
                "ADMIN, EDITOR, true",
                "OWNER, ADMIN, true",
                "ADMIN, OWNER, false"
        })
        void isAtLeast(ProjectRole role, ProjectRole required, boolean expected) {
            assertThat(role.isAtLeast(required)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("permissions")
    class Permissions {

        @Test
        @DisplayName("viewer can only read")
        void viewer() {
            assertThat(ProjectRole.VIEWER.permissions()).containsExactly(Permission.PROJECT_READ);
        }

        @Test
        @DisplayName("editor can read, edit and view cost")
        void editor() {
            assertThat(ProjectRole.EDITOR.permissions())
                    .containsExactlyInAnyOrder(Permission.PROJECT_READ, Permission.PROJECT_EDIT, Permission.COST_VIEW);
            assertThat(ProjectRole.EDITOR.grants(Permission.TEAM_MANAGE)).isFalse();
        }

        @Test
        @DisplayName("admin and owner hold every permission")
        void adminAndOwner() {
            assertThat(ProjectRole.ADMIN.permissions()).containsExactlyInAnyOrder(Permission.values());
            assertThat(ProjectRole.OWNER.permissions()).containsExactlyInAnyOrder(Permission.values());
        }
    }

    @Nested
    @DisplayName("fromString")
    class FromString {

        @Test
        @DisplayName("resolves stored labels case-insensitively")
        void resolvesLabels() {
            assertThat(ProjectRole.fromString("editor")).contains(ProjectRole.EDITOR);
            assertThat(ProjectRole.fromString(" Owner ")).contains(ProjectRole.OWNER);
        }

        @Test
        @DisplayName("unknown or null labels resolve to nothing")
        void unknownLabels() {
            assertThat(ProjectRole.fromString("superuser")).isEmpty();
            assertThat(ProjectRole.fromString(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("permission values round-trip through fromString")
    void permissionValues() {
        assertThat(Permission.fromString("cost:view")).contains(Permission.COST_VIEW);
        assertThat(Permission.fromString("cost:edit")).isEmpty();
    }
}
