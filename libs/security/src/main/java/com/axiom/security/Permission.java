package com.axiom.security;

import java.util.Optional;

/**
 * Project-scoped permissions checked by the access authorizer.
 */
public enum Permission {

    PROJECT_READ("project:read"),
    PROJECT_EDIT("project:edit"),
    PROJECT_DELETE("project:delete"),
    TEAM_MANAGE("team:manage"),
    COST_VIEW("cost:view"),
    BUDGET_APPROVE("budget:approve");

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "project:read"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a Permission by its canonical string value.
     *
     * @param value the string to match
     * @return the matching Permission, or empty if not found
     */
    public static Optional<Permission> fromString(String value) {
        for (Permission permission : values()) {
            if (permission.value.equals(value)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
