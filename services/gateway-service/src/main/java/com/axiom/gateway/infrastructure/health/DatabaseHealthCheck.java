package com.axiom.gateway.infrastructure.health;

import com.axiom.database.migration.MigrationService;
import com.axiom.observability.ComponentHealth;
import com.axiom.observability.HealthCheck;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Probes the relational store with {@code SELECT 1}. A reachable database with pending
 * migrations is reported as degraded.
 */
public class DatabaseHealthCheck implements HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(DatabaseHealthCheck.class);

    public static final String NAME = "database";

    private final JdbcTemplate jdbcTemplate;
    private final MigrationService migrations;

    /**
     * @param migrations migration status source, or null when migrations are managed elsewhere
     */
    public DatabaseHealthCheck(JdbcTemplate jdbcTemplate, MigrationService migrations) {
        this.jdbcTemplate = jdbcTemplate;
        this.migrations = migrations;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(this::probe);
    }

    ComponentHealth probe() {
        long start = System.nanoTime();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            if (migrations != null) {
                MigrationService.DatabaseStatus status = migrations.status();
                if (!status.upToDate()) {
                    return ComponentHealth.degraded(NAME,
                            status.pendingMigrations() + " pending migrations", elapsedMs(start));
                }
            }
            return ComponentHealth.healthy(NAME, elapsedMs(start));
        } catch (DataAccessException e) {
            log.warn("Database health probe failed: {}", e.getMessage());
            Throwable cause = e.getMostSpecificCause();
            String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return ComponentHealth.unhealthy(NAME, reason, elapsedMs(start));
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
