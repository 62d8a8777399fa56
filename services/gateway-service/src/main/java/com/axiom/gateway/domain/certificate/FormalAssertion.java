package com.axiom.gateway.domain.certificate;

/** A property checked by a formal verifier. {@code evidence} is optional. */
public record FormalAssertion(String type, String description, boolean verified, String evidence) {

    public FormalAssertion {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("assertion type must not be blank");
        }
    }
}
