package com.axiom.security;

/**
 * Project role and permission checks with hierarchy support.
 * <p>
 * A null role (no membership) satisfies nothing.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the effective role reaches the required role in the hierarchy.
     * <p>
     * Example: {@code hasRole(OWNER, ADMIN)} is true, {@code hasRole(VIEWER, EDITOR)} is false.
     */
    public static boolean hasRole(ProjectRole effective, ProjectRole required) {
        return effective != null && effective.isAtLeast(required);
    }

    /**
     * Checks if the effective role grants the permission.
     */
    public static boolean hasPermission(ProjectRole effective, Permission permission) {
        return effective != null && effective.grants(permission);
    }
}
