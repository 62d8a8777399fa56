package com.axiom.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Roles a user can hold within a single project, ordered
 * {@code VIEWER < EDITOR < ADMIN < OWNER}.
 * <p>
 * Each role maps to a fixed permission set:
 * <ul>
 *   <li>VIEWER: project:read</li>
 *   <li>EDITOR: project:read, project:edit, cost:view</li>
 *   <li>ADMIN and OWNER: every permission</li>
 * </ul>
 */
public enum ProjectRole {

    VIEWER("viewer", 1),
    EDITOR("editor", 2),
    ADMIN("admin", 3),
    OWNER("owner", 4);

    private final String value;
    private final int rank;

    ProjectRole(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    /** The label stored in {@code project_members.role} (e.g., "editor"). */
    public String value() {
        return value;
    }

    /** Position in the hierarchy; higher ranks include lower ones. */
    public int rank() {
        return rank;
    }

    /**
     * Checks whether this role is at least as privileged as the required role.
     */
    public boolean isAtLeast(ProjectRole required) {
        return rank >= required.rank;
    }

    /**
     * Returns the permissions granted by this role.
     */
    public Set<Permission> permissions() {
        return switch (this) {
            case VIEWER -> Collections.unmodifiableSet(EnumSet.of(Permission.PROJECT_READ));
            case EDITOR -> Collections.unmodifiableSet(
                    EnumSet.of(Permission.PROJECT_READ, Permission.PROJECT_EDIT, Permission.COST_VIEW));
            case ADMIN, OWNER -> Collections.unmodifiableSet(EnumSet.allOf(Permission.class));
        };
    }

    /**
     * Checks whether this role grants the given permission.
     */
    public boolean grants(Permission permission) {
        return permissions().contains(permission);
    }

    /**
     * Looks up a role by its stored label, case-insensitively.
     *
     * @param value the label to match (may be null)
     * @return the matching role, or empty for unknown labels
     */
    public static Optional<ProjectRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (ProjectRole role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
