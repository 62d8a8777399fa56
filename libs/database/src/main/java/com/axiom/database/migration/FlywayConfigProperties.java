package com.axiom.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the Axiom schema.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * axiom:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration
 *     baseline-on-migrate: true
 * }</pre>
 *
 * @param enabled whether to run migrations against the application DataSource on startup
 * @param locations Flyway migration locations
 * @param baselineOnMigrate whether to baseline a non-empty schema that has no history table
 * @param database logical database name reported by {@link MigrationService}
 */
@Validated
@ConfigurationProperties(prefix = "axiom.flyway")
public record FlywayConfigProperties(
        Boolean enabled,
        @NotBlank String locations,
        Boolean baselineOnMigrate,
        @NotBlank String database) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration";

    public FlywayConfigProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (locations == null) {
            locations = DEFAULT_LOCATIONS;
        }
        if (baselineOnMigrate == null) {
            baselineOnMigrate = Boolean.TRUE;
        }
        if (database == null) {
            database = "axiom";
        }
    }
}
