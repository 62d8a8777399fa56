package com.axiom.gateway.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.axiom.database.migration.MigrationService;
import com.axiom.gateway.support.TestDatabase;
import com.axiom.observability.ComponentHealth;
import com.axiom.observability.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("DatabaseHealthCheck")
class DatabaseHealthCheckTest {

    @Test
    @DisplayName("is healthy when the database answers")
    void reachable() {
        var check = new DatabaseHealthCheck(new JdbcTemplate(TestDatabase.migrated().dataSource()), null);

        ComponentHealth health = check.check().join();

        assertThat(health.name()).isEqualTo(DatabaseHealthCheck.NAME);
        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("is degraded when migrations are pending")
    void pendingMigrations() {
        MigrationService migrations = mock(MigrationService.class);
        when(migrations.status()).thenReturn(new MigrationService.DatabaseStatus("axiom", 1, 1, "1"));
        var check = new DatabaseHealthCheck(new JdbcTemplate(TestDatabase.migrated().dataSource()), migrations);

        ComponentHealth health = check.probe();

        assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(health.message()).isEqualTo("1 pending migrations");
    }

    @Test
    @DisplayName("is unhealthy when the probe query fails")
    void unreachable() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        when(jdbcTemplate.queryForObject(eq("SELECT 1"), eq(Integer.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        var check = new DatabaseHealthCheck(jdbcTemplate, null);

        ComponentHealth health = check.probe();

        assertThat(health.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(health.message()).isEqualTo("connection refused");
    }
}
