package com.axiom.gateway.domain.ivcu;

import java.util.Arrays;
import java.util.Optional;

/** Lifecycle states of an IVCU. Values are the stored lowercase labels. */
public enum IvcuStatus {
    DRAFT("draft"),
    GENERATING("generating"),
    VERIFYING("verifying"),
    VERIFIED("verified"),
    FAILED("failed"),
    DEPLOYED("deployed"),
    DEPRECATED("deprecated");

    private final String value;

    IvcuStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** No transition leaves a terminal state. */
    public boolean isTerminal() {
        return this == FAILED || this == DEPRECATED;
    }

    /** Case-insensitive lookup by stored label. */
    public static Optional<IvcuStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
