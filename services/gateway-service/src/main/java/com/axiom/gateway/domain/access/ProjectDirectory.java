package com.axiom.gateway.domain.access;

import com.axiom.security.ProjectRole;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Port for project and membership lookups, and for maintaining a project's member list.
 */
public interface ProjectDirectory {

    /** Role label of an explicit membership row, if one exists. */
    Optional<String> findMemberRole(UUID projectId, UUID userId);

    Optional<ProjectRef> findProject(UUID projectId);

    Optional<UUID> findUserIdByEmail(String email);

    /** Explicit members of the project, oldest first. The owner appears only with a membership row. */
    List<TeamMember> listMembers(UUID projectId);

    Optional<TeamMember> findMember(UUID projectId, UUID userId);

    /** Adds the membership, or replaces the role when the user is already a member. */
    void upsertMember(UUID projectId, UUID userId, ProjectRole role);

    /** @return whether a membership row was removed */
    boolean deleteMember(UUID projectId, UUID userId);
}
