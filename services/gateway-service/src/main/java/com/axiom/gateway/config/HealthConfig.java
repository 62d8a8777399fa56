package com.axiom.gateway.config;

import com.axiom.database.migration.MigrationService;
import com.axiom.gateway.infrastructure.health.CircuitBreakerHealthCheck;
import com.axiom.gateway.infrastructure.health.DatabaseHealthCheck;
import com.axiom.observability.HealthCheckRegistry;
import com.axiom.resilience.CircuitBreakerRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Deep health checks: the database plus one check per dependency breaker.
 */
@Configuration
public class HealthConfig {

    @Bean
    public HealthCheckRegistry healthCheckRegistry(JdbcTemplate jdbcTemplate,
                                                   ObjectProvider<MigrationService> migrations,
                                                   CircuitBreakerRegistry breakers) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(DatabaseHealthCheck.NAME,
                new DatabaseHealthCheck(jdbcTemplate, migrations.getIfAvailable()));
        breakers.all().forEach((name, breaker) ->
                registry.registerOptional("circuit:" + name, new CircuitBreakerHealthCheck(breaker)));
        return registry;
    }
}
