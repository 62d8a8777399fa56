package com.axiom.eventmodel;

import com.axiom.eventmodel.payload.AdmissionDeniedPayload;
import com.axiom.eventmodel.payload.CertificateIssuedPayload;
import com.axiom.eventmodel.payload.CircuitStateChangedPayload;
import com.axiom.eventmodel.payload.IvcuStatusChangedPayload;
import com.axiom.eventmodel.payload.UsageRecordedPayload;
import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of events published by the gateway. Each type fixes its canonical wire name,
 * its payload record and whether envelopes of the type must name a project.
 */
public enum EventType {

    IVCU_CREATED("IvcuCreated", IvcuStatusChangedPayload.class, true),
    IVCU_STATUS_CHANGED("IvcuStatusChanged", IvcuStatusChangedPayload.class, true),
    CERTIFICATE_ISSUED("CertificateIssued", CertificateIssuedPayload.class, true),
    USAGE_RECORDED("UsageRecorded", UsageRecordedPayload.class, true),

    // platform-level: dependency breakers and denials not tied to a project
    CIRCUIT_STATE_CHANGED("CircuitStateChanged", CircuitStateChangedPayload.class, false),
    ADMISSION_DENIED("AdmissionDenied", AdmissionDeniedPayload.class, false);

    private final String value;
    private final Class<?> payloadType;
    private final boolean projectScoped;

    EventType(String value, Class<?> payloadType, boolean projectScoped) {
        this.value = value;
        this.payloadType = payloadType;
        this.projectScoped = projectScoped;
    }

    /** Wire name, e.g. {@code CertificateIssued}. */
    public String value() {
        return value;
    }

    public Class<?> payloadType() {
        return payloadType;
    }

    public boolean projectScoped() {
        return projectScoped;
    }

    public static Optional<EventType> fromString(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
