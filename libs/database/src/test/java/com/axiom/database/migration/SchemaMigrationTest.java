package com.axiom.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Migrates a fresh in-memory H2 database (PostgreSQL mode) and checks the resulting schema.
 */
@DisplayName("Schema migrations")
class SchemaMigrationTest {

    private JdbcTemplate jdbc;
    private MigrationService migrationService;

    private final UUID userId = UUID.randomUUID();
    private final UUID projectId = UUID.randomUUID();
    private final UUID ivcuId = UUID.randomUUID();

    @BeforeEach
    void migrate() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");

        Flyway flyway = FlywayMigrationConfig.createFlyway(dataSource, new FlywayConfigProperties(null, null, null, null));
        flyway.migrate();

        jdbc = new JdbcTemplate(dataSource);
        migrationService = new MigrationService(flyway, "axiom");

        jdbc.update("INSERT INTO users (id, email, name) VALUES (?, ?, ?)", userId, "dev@axiom.local", "Dev");
        jdbc.update("INSERT INTO projects (id, name, owner_id) VALUES (?, ?, ?)", projectId, "demo", userId);
        jdbc.update("INSERT INTO ivcus (id, project_id, raw_intent, created_by) VALUES (?, ?, ?, ?)",
                ivcuId, projectId, "sum two numbers", userId);
    }

    @Nested
    @DisplayName("MigrationService")
    class Status {

        @Test
        @DisplayName("reports every migration applied")
        void reportsApplied() {
            var status = migrationService.status();

            assertThat(status.appliedMigrations()).isEqualTo(2);
            assertThat(status.pendingMigrations()).isZero();
            assertThat(status.currentVersion()).isEqualTo("2");
            assertThat(status.upToDate()).isTrue();
        }

        @Test
        @DisplayName("lists migrations in version order with install time")
        void listsMigrations() {
            var migrations = migrationService.migrations();

            assertThat(migrations).extracting(MigrationService.MigrationInfo::version).containsExactly("1", "2");
            assertThat(migrations).allSatisfy(m -> {
                assertThat(m.state()).isEqualTo("SUCCESS");
                assertThat(m.installedOn()).isNotNull();
            });
        }
    }

    @Nested
    @DisplayName("projects")
    class Projects {

        @Test
        @DisplayName("new project starts with zero usage and no explicit budget")
        void defaults() {
            var row = jdbc.queryForMap("SELECT budget_limit, current_usage FROM projects WHERE id = ?", projectId);

            assertThat(row.get("budget_limit")).isNull();
            assertThat(((java.math.BigDecimal) row.get("current_usage")).signum()).isZero();
        }
    }

    @Nested
    @DisplayName("proof_certificates")
    class ProofCertificates {

        private int insertCertificate(String proofType) {
            return jdbc.update("""
                    INSERT INTO proof_certificates (id, ivcu_id, proof_type, verifier_version, issued_at, intent_id,
                        ast_hash, code_hash, proof_data, hash_chain, signature)
                    VALUES (?, ?, ?, '1.0.0', '2026-01-01T00:00:00Z', ?, ?, ?, ?, ?, ?)
                    """,
                    UUID.randomUUID(), ivcuId, proofType, UUID.randomUUID(),
                    "a".repeat(64), "b".repeat(64), new byte[0], "c".repeat(64), "d".repeat(64));
        }

        @Test
        @DisplayName("accepts one certificate per proof type")
        void onePerType() {
            assertThat(insertCertificate("type_safety")).isEqualTo(1);
            assertThat(insertCertificate("memory_safety")).isEqualTo(1);
        }

        @Test
        @DisplayName("rejects a second certificate for the same ivcu and proof type")
        void rejectsDuplicate() {
            insertCertificate("type_safety");

            assertThatThrownBy(() -> insertCertificate("type_safety"))
                    .isInstanceOf(DuplicateKeyException.class);
        }

        @Test
        @DisplayName("rejects unknown proof types")
        void rejectsUnknownType() {
            assertThatThrownBy(() -> insertCertificate("vibes"))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }
    }

    @Test
    @DisplayName("ivcu status is restricted to known states")
    void ivcuStatusCheck() {
        assertThatThrownBy(() -> jdbc.update("UPDATE ivcus SET status = 'shipped' WHERE id = ?", ivcuId))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
