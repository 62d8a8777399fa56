package com.axiom.gateway.domain.admission;

import java.util.List;

/** Names of the downstream dependencies guarded by circuit breakers. */
public final class Dependencies {

    public static final String GENERATION = "generation";
    public static final String VERIFICATION = "verification";

    public static final List<String> ALL = List.of(GENERATION, VERIFICATION);

    private Dependencies() {
    }
}
