package com.axiom.gateway.infrastructure.persistence;

import com.axiom.gateway.domain.access.ProjectDirectory;
import com.axiom.gateway.domain.access.ProjectRef;
import com.axiom.gateway.domain.access.TeamMember;
import com.axiom.security.ProjectRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Project and membership lookups on {@code projects} and {@code project_members}. */
@Repository
public class JdbcProjectDirectory implements ProjectDirectory {

    private static final String SELECT_MEMBERS = """
            SELECT u.id, u.name, u.email, pm.role, pm.added_at
            FROM project_members pm
            JOIN users u ON pm.user_id = u.id
            WHERE pm.project_id = :projectId
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcProjectDirectory(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<String> findMemberRole(UUID projectId, UUID userId) {
        String sql = """
                SELECT role FROM project_members
                WHERE project_id = :projectId AND user_id = :userId
                """;
        return JdbcErrors.translate("read project membership", () -> jdbcTemplate.query(sql,
                membership(projectId, userId),
                (rs, rowNum) -> rs.getString("role")).stream().findFirst());
    }

    @Override
    public Optional<ProjectRef> findProject(UUID projectId) {
        String sql = "SELECT id, name, owner_id FROM projects WHERE id = :projectId";
        return JdbcErrors.translate("read project", () -> jdbcTemplate.query(sql,
                new MapSqlParameterSource().addValue("projectId", projectId),
                (rs, rowNum) -> new ProjectRef(
                        rs.getObject("id", UUID.class),
                        rs.getString("name"),
                        rs.getObject("owner_id", UUID.class))).stream().findFirst());
    }

    @Override
    public Optional<UUID> findUserIdByEmail(String email) {
        String sql = "SELECT id FROM users WHERE email = :email";
        return JdbcErrors.translate("read user", () -> jdbcTemplate.query(sql,
                new MapSqlParameterSource().addValue("email", email),
                (rs, rowNum) -> rs.getObject("id", UUID.class)).stream().findFirst());
    }

    @Override
    public List<TeamMember> listMembers(UUID projectId) {
        String sql = SELECT_MEMBERS + "ORDER BY pm.added_at, u.email";
        return JdbcErrors.translate("list project members", () -> jdbcTemplate.query(sql,
                new MapSqlParameterSource().addValue("projectId", projectId),
                (rs, rowNum) -> mapMember(rs)));
    }

    @Override
    public Optional<TeamMember> findMember(UUID projectId, UUID userId) {
        String sql = SELECT_MEMBERS + "AND pm.user_id = :userId";
        return JdbcErrors.translate("read project member", () -> jdbcTemplate.query(sql,
                membership(projectId, userId),
                (rs, rowNum) -> mapMember(rs)).stream().findFirst());
    }

    /**
     * Update first, then insert. A concurrent insert of the same membership surfaces as a
     * duplicate key and is resolved by updating the row that won.
     */
    @Override
    public void upsertMember(UUID projectId, UUID userId, ProjectRole role) {
        MapSqlParameterSource params = membership(projectId, userId).addValue("role", role.value());
        String update = """
                UPDATE project_members SET role = :role
                WHERE project_id = :projectId AND user_id = :userId
                """;
        String insert = """
                INSERT INTO project_members (project_id, user_id, role)
                VALUES (:projectId, :userId, :role)
                """;
        JdbcErrors.run("save project member", () -> {
            if (jdbcTemplate.update(update, params) > 0) {
                return;
            }
            try {
                jdbcTemplate.update(insert, params);
            } catch (DuplicateKeyException e) {
                jdbcTemplate.update(update, params);
            }
        });
    }

    @Override
    public boolean deleteMember(UUID projectId, UUID userId) {
        String sql = "DELETE FROM project_members WHERE project_id = :projectId AND user_id = :userId";
        return JdbcErrors.translate("remove project member",
                () -> jdbcTemplate.update(sql, membership(projectId, userId)) > 0);
    }

    private static MapSqlParameterSource membership(UUID projectId, UUID userId) {
        return new MapSqlParameterSource()
                .addValue("projectId", projectId)
                .addValue("userId", userId);
    }

    private static TeamMember mapMember(ResultSet rs) throws SQLException {
        return new TeamMember(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                rs.getString("email"),
                rs.getString("role"),
                rs.getTimestamp("added_at").toInstant());
    }
}
