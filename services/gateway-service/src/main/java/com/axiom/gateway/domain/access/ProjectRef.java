package com.axiom.gateway.domain.access;

import java.util.UUID;

/** Minimal view of a project used for access decisions. {@code ownerId} may be null. */
public record ProjectRef(UUID id, String name, UUID ownerId) {
}
