package com.axiom.gateway.domain.access;

import java.time.Instant;
import java.util.UUID;

/** An explicit membership row joined with the member's user record. {@code role} is the stored label. */
public record TeamMember(UUID userId, String name, String email, String role, Instant addedAt) {
}
