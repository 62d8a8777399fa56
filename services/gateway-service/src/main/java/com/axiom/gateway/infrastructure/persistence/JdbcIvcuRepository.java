package com.axiom.gateway.infrastructure.persistence;

import com.axiom.gateway.domain.error.PersistenceException;
import com.axiom.gateway.domain.error.StaleIvcuException;
import com.axiom.gateway.domain.ivcu.Ivcu;
import com.axiom.gateway.domain.ivcu.IvcuRepository;
import com.axiom.gateway.domain.ivcu.IvcuStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** IVCUs on {@code ivcus}, with ordered lineage in {@code ivcu_parents}. */
@Repository
public class JdbcIvcuRepository implements IvcuRepository {

    private static final String COLUMNS = """
            id, project_id, version, raw_intent, code, language, status, confidence_score,
            model_id, created_by, created_at, updated_at
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcIvcuRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void insert(Ivcu ivcu) {
        String sql = "INSERT INTO ivcus (" + COLUMNS + """
                ) VALUES (:id, :projectId, :version, :rawIntent, :code, :language, :status, :confidenceScore,
                          :modelId, :createdBy, :createdAt, :updatedAt)
                """;
        JdbcErrors.run("insert ivcu", () -> {
            jdbcTemplate.update(sql, new MapSqlParameterSource()
                    .addValue("id", ivcu.id())
                    .addValue("projectId", ivcu.projectId())
                    .addValue("version", ivcu.version())
                    .addValue("rawIntent", ivcu.rawIntent())
                    .addValue("code", ivcu.code())
                    .addValue("language", ivcu.language())
                    .addValue("status", ivcu.status().value())
                    .addValue("confidenceScore", ivcu.confidenceScore())
                    .addValue("modelId", ivcu.modelId())
                    .addValue("createdBy", ivcu.createdBy())
                    .addValue("createdAt", Timestamp.from(ivcu.createdAt()))
                    .addValue("updatedAt", Timestamp.from(ivcu.updatedAt())));

            List<UUID> parents = ivcu.parentIds();
            if (!parents.isEmpty()) {
                SqlParameterSource[] rows = new SqlParameterSource[parents.size()];
                for (int i = 0; i < parents.size(); i++) {
                    rows[i] = new MapSqlParameterSource()
                            .addValue("ivcuId", ivcu.id())
                            .addValue("parentId", parents.get(i))
                            .addValue("ordinal", i);
                }
                jdbcTemplate.batchUpdate(
                        "INSERT INTO ivcu_parents (ivcu_id, parent_id, ordinal) VALUES (:ivcuId, :parentId, :ordinal)",
                        rows);
            }
        });
    }

    @Override
    public void update(Ivcu ivcu, IvcuStatus expectedStatus) {
        String sql = """
                UPDATE ivcus
                SET status = :status, code = :code, model_id = :modelId,
                    confidence_score = :confidenceScore, updated_at = :updatedAt
                WHERE id = :id AND status = :expectedStatus
                """;
        int updated = JdbcErrors.translate("update ivcu", () -> jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("id", ivcu.id())
                .addValue("expectedStatus", expectedStatus.value())
                .addValue("status", ivcu.status().value())
                .addValue("code", ivcu.code())
                .addValue("modelId", ivcu.modelId())
                .addValue("confidenceScore", ivcu.confidenceScore())
                .addValue("updatedAt", Timestamp.from(ivcu.updatedAt()))));
        if (updated == 0) {
            Integer rows = JdbcErrors.translate("update ivcu", () -> jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM ivcus WHERE id = :id",
                    new MapSqlParameterSource().addValue("id", ivcu.id()), Integer.class));
            if (rows == null || rows == 0) {
                throw new PersistenceException("ivcu " + ivcu.id() + " vanished during update", null);
            }
            throw new StaleIvcuException(ivcu.id(), expectedStatus.value());
        }
    }

    @Override
    public Optional<Ivcu> findById(UUID id) {
        String sql = "SELECT " + COLUMNS + " FROM ivcus WHERE id = :id";
        return JdbcErrors.translate("read ivcu", () -> {
            List<UUID> parents = jdbcTemplate.query(
                    "SELECT parent_id FROM ivcu_parents WHERE ivcu_id = :id ORDER BY ordinal",
                    new MapSqlParameterSource().addValue("id", id),
                    (rs, rowNum) -> rs.getObject("parent_id", UUID.class));
            return jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("id", id),
                    (rs, rowNum) -> mapIvcu(rs, parents)).stream().findFirst();
        });
    }

    private static Ivcu mapIvcu(ResultSet rs, List<UUID> parents) throws SQLException {
        String status = rs.getString("status");
        double confidence = rs.getDouble("confidence_score");
        Double confidenceScore = rs.wasNull() ? null : confidence;
        return new Ivcu(
                rs.getObject("id", UUID.class),
                rs.getObject("project_id", UUID.class),
                rs.getInt("version"),
                rs.getString("raw_intent"),
                rs.getString("code"),
                rs.getString("language"),
                IvcuStatus.fromValue(status)
                        .orElseThrow(() -> new PersistenceException("unknown ivcu status '" + status + "'", null)),
                confidenceScore,
                rs.getString("model_id"),
                rs.getObject("created_by", UUID.class),
                parents,
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }
}
