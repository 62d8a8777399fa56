package com.axiom.gateway.api.dto;

import java.util.List;
import java.util.UUID;

/** {@code ownerId} is listed separately; the owner is a member without needing a row. */
public record TeamResponse(UUID projectId, UUID ownerId, List<TeamMemberResponse> members) {
}
