package com.axiom.gateway.domain.admission;

import com.axiom.security.Permission;

/**
 * Operations that pass through admission, with the gates each one is subject to.
 * A null permission means the operation is not project-scoped; a null dependency means no
 * circuit breaker applies.
 */
public enum GatedOperation {
    START_GENERATION(true, Permission.PROJECT_EDIT, RateLimitTier.STRICT, Dependencies.GENERATION, true),
    RUN_VERIFICATION(true, Permission.PROJECT_EDIT, RateLimitTier.STRICT, Dependencies.VERIFICATION, true),
    READ_IVCU(true, Permission.PROJECT_READ, RateLimitTier.DEFAULT, null, false),
    TRANSITION_IVCU(true, Permission.PROJECT_EDIT, RateLimitTier.DEFAULT, null, false),
    ISSUE_CERTIFICATE(true, Permission.PROJECT_EDIT, RateLimitTier.DEFAULT, null, false),
    VIEW_CERTIFICATE(true, Permission.PROJECT_READ, RateLimitTier.DEFAULT, null, false),
    VERIFY_CERTIFICATE(false, null, RateLimitTier.DEFAULT, null, false),
    VIEW_COST(true, Permission.COST_VIEW, RateLimitTier.DEFAULT, null, false),
    LIST_MEMBERS(true, Permission.PROJECT_READ, RateLimitTier.DEFAULT, null, false),
    MANAGE_TEAM(true, Permission.TEAM_MANAGE, RateLimitTier.DEFAULT, null, false);

    private final boolean requiresAuthentication;
    private final Permission permission;
    private final RateLimitTier tier;
    private final String dependency;
    private final boolean incursCost;

    GatedOperation(boolean requiresAuthentication, Permission permission, RateLimitTier tier,
                   String dependency, boolean incursCost) {
        this.requiresAuthentication = requiresAuthentication;
        this.permission = permission;
        this.tier = tier;
        this.dependency = dependency;
        this.incursCost = incursCost;
    }

    public boolean requiresAuthentication() {
        return requiresAuthentication;
    }

    public Permission permission() {
        return permission;
    }

    public boolean projectScoped() {
        return permission != null;
    }

    public RateLimitTier tier() {
        return tier;
    }

    public String dependency() {
        return dependency;
    }

    public boolean incursCost() {
        return incursCost;
    }
}
