package com.axiom.gateway.infrastructure.persistence;

import com.axiom.gateway.domain.budget.BudgetRepository;
import com.axiom.gateway.domain.budget.ProjectBudget;
import com.axiom.gateway.domain.budget.UsageDetails;
import com.axiom.gateway.domain.budget.UsageLogEntry;
import com.axiom.gateway.domain.error.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Budget state on {@code projects.current_usage} and the {@code usage_logs} audit trail.
 * Usage details are stored as JSON text.
 */
@Repository
public class JdbcBudgetRepository implements BudgetRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcBudgetRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ProjectBudget> findBudget(UUID projectId) {
        String sql = "SELECT id, budget_limit, current_usage FROM projects WHERE id = :projectId";
        return JdbcErrors.translate("read project budget", () -> jdbcTemplate.query(sql,
                new MapSqlParameterSource().addValue("projectId", projectId),
                (rs, rowNum) -> new ProjectBudget(
                        rs.getObject("id", UUID.class),
                        rs.getBigDecimal("budget_limit"),
                        rs.getBigDecimal("current_usage"))).stream().findFirst());
    }

    @Override
    public int incrementUsage(UUID projectId, BigDecimal cost) {
        String sql = """
                UPDATE projects
                SET current_usage = current_usage + :cost, updated_at = CURRENT_TIMESTAMP
                WHERE id = :projectId
                """;
        return JdbcErrors.translate("update project usage", () -> jdbcTemplate.update(sql,
                new MapSqlParameterSource()
                        .addValue("projectId", projectId)
                        .addValue("cost", cost)));
    }

    @Override
    public void insertUsageLog(UsageLogEntry entry) {
        String sql = """
                INSERT INTO usage_logs (id, project_id, user_id, cost, operation_type, details, created_at)
                VALUES (:id, :projectId, :userId, :cost, :operationType, :details, :createdAt)
                """;
        String details = toJson(entry.details());
        JdbcErrors.run("write usage log", () -> jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("id", entry.id())
                .addValue("projectId", entry.projectId())
                .addValue("userId", entry.userId())
                .addValue("cost", entry.cost())
                .addValue("operationType", entry.operationType())
                .addValue("details", details)
                .addValue("createdAt", Timestamp.from(entry.createdAt()))));
    }

    @Override
    public List<UsageLogEntry> findUsageLogs(UUID projectId, int limit) {
        String sql = """
                SELECT id, project_id, user_id, cost, operation_type, details, created_at
                FROM usage_logs
                WHERE project_id = :projectId
                ORDER BY created_at DESC
                LIMIT :limit
                """;
        return JdbcErrors.translate("read usage logs", () -> jdbcTemplate.query(sql,
                new MapSqlParameterSource()
                        .addValue("projectId", projectId)
                        .addValue("limit", limit),
                (rs, rowNum) -> mapEntry(rs)));
    }

    private UsageLogEntry mapEntry(ResultSet rs) throws SQLException {
        return new UsageLogEntry(
                rs.getObject("id", UUID.class),
                rs.getObject("project_id", UUID.class),
                rs.getObject("user_id", UUID.class),
                rs.getBigDecimal("cost"),
                rs.getString("operation_type"),
                fromJson(rs.getString("details")),
                rs.getTimestamp("created_at").toInstant());
    }

    private String toJson(UsageDetails details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("failed to serialize usage details", e);
        }
    }

    private UsageDetails fromJson(String json) {
        if (json == null || json.isBlank()) {
            return UsageDetails.empty();
        }
        try {
            return objectMapper.readValue(json, UsageDetails.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("failed to read usage details", e);
        }
    }
}
