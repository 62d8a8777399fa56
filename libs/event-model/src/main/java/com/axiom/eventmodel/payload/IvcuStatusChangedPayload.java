package com.axiom.eventmodel.payload;

/**
 * Payload of {@code IvcuCreated} and {@code IvcuStatusChanged}. {@code fromStatus} is null on creation.
 */
public record IvcuStatusChangedPayload(String ivcuId, int version, String fromStatus, String toStatus) {
}
