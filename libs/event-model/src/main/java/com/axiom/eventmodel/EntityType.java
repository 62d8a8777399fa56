package com.axiom.eventmodel;

import java.util.Optional;

/** Entity kinds that events refer to. */
public enum EntityType {
    IVCU("Ivcu"),
    PROJECT("Project"),
    PROOF_CERTIFICATE("ProofCertificate"),
    DEPENDENCY("Dependency");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }

    public static Optional<EntityType> fromString(String value) {
        for (EntityType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
