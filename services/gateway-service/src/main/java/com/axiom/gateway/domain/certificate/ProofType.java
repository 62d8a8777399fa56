package com.axiom.gateway.domain.certificate;

import java.util.Arrays;
import java.util.Optional;

/** Kind of property a certificate attests to. */
public enum ProofType {
    TYPE_SAFETY("type_safety"),
    MEMORY_SAFETY("memory_safety"),
    CONTRACT_COMPLIANCE("contract_compliance"),
    PROPERTY_BASED("property_based");

    private final String value;

    ProofType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ProofType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
