package com.axiom.gateway;

import com.axiom.database.migration.FlywayMigrationConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Axiom gateway: admits requests through the authentication, authorization, rate limit,
 * circuit breaker and budget gates, drives the IVCU lifecycle and issues proof certificates.
 *
 * <p>The Axiom schema is migrated on startup by {@link FlywayMigrationConfig}.
 */
@SpringBootApplication
@Import(FlywayMigrationConfig.class)
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
