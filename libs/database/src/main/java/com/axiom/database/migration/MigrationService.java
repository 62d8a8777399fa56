package com.axiom.database.migration;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Reports migration state of the Axiom database.
 *
 * <p>This is a POJO (no Spring annotations) so it can be built in unit tests from any
 * {@link Flyway} instance. The deep health check and the service info endpoint read from it.
 */
public class MigrationService {

    /**
     * Status of a single migration.
     *
     * @param database database name (e.g., "axiom")
     * @param version migration version (e.g., "1", "2"); null for repeatable migrations
     * @param description migration description (e.g., "core schema")
     * @param state migration state (e.g., "SUCCESS", "PENDING", "FAILED")
     * @param installedOn ISO-8601 timestamp of when the migration was applied; null if pending
     */
    public record MigrationInfo(
            String database,
            String version,
            String description,
            String state,
            String installedOn) {}

    /**
     * Overall status of a database's migrations.
     *
     * @param database database name (e.g., "axiom")
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no migrations applied)
     */
    public record DatabaseStatus(
            String database,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion) {

        /** True when every known migration has been applied. */
        public boolean upToDate() {
            return pendingMigrations == 0 && currentVersion != null;
        }
    }

    private final Flyway flyway;
    private final String database;

    public MigrationService(Flyway flyway, String database) {
        this.flyway = flyway;
        this.database = database;
    }

    /**
     * Reads the schema history and summarizes it. Touches the database on every call.
     */
    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        org.flywaydb.core.api.MigrationInfo current = info.current();
        return new DatabaseStatus(
                database,
                info.applied().length,
                info.pending().length,
                current != null && current.getVersion() != null ? current.getVersion().getVersion() : null);
    }

    /**
     * Lists every known migration, applied or pending, in version order.
     */
    public List<MigrationInfo> migrations() {
        return Arrays.stream(flyway.info().all())
                .map(this::toInfo)
                .toList();
    }

    private MigrationInfo toInfo(org.flywaydb.core.api.MigrationInfo info) {
        return new MigrationInfo(
                database,
                info.getVersion() != null ? info.getVersion().getVersion() : null,
                info.getDescription(),
                info.getState().name(),
                info.getInstalledOn() != null ? Instant.ofEpochMilli(info.getInstalledOn().getTime()).toString() : null);
    }
}
