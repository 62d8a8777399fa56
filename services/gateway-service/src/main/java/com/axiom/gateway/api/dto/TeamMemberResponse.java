package com.axiom.gateway.api.dto;

import com.axiom.gateway.domain.access.TeamMember;
import java.time.Instant;
import java.util.UUID;

public record TeamMemberResponse(UUID userId, String name, String email, String role, Instant addedAt) {

    public static TeamMemberResponse from(TeamMember member) {
        return new TeamMemberResponse(member.userId(), member.name(), member.email(), member.role(),
                member.addedAt());
    }
}
