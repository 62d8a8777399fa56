package com.axiom.eventmodel.payload;

import java.math.BigDecimal;

/** Payload of {@code UsageRecorded}. */
public record UsageRecordedPayload(String userId, BigDecimal cost, String operationType) {
}
