package com.axiom.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the Axiom schema.
 *
 * <p>Creates a single Flyway instance bound to the application {@link DataSource} and migrates
 * it when the bean is initialized. Because a {@link Flyway} bean is present, Spring Boot's own
 * Flyway auto-configuration backs off; services may also set {@code spring.flyway.enabled=false}.
 *
 * <p>Clean is always disabled: the schema holds the certificate audit trail.
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "axiom.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlywayMigrationConfig {

    /** Bean name for the Axiom Flyway instance. */
    public static final String AXIOM_FLYWAY_BEAN = "axiomFlyway";

    @Bean(name = AXIOM_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway axiomFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return createFlyway(dataSource, properties);
    }

    @Bean
    public MigrationService migrationService(Flyway axiomFlyway, FlywayConfigProperties properties) {
        return new MigrationService(axiomFlyway, properties.database());
    }

    /**
     * Builds a Flyway instance without running it. Used by the bean above and by tests that
     * migrate a throwaway database directly.
     */
    public static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
