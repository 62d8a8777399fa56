package com.axiom.gateway.api;

import com.axiom.database.migration.MigrationService;
import com.axiom.gateway.config.ServiceProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runtime identity of the gateway, plus the schema version when migrations are managed here.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final ObjectProvider<MigrationService> migrations;
    private final Clock clock;

    public ServiceInfoController(ServiceProperties properties, ObjectProvider<MigrationService> migrations,
                                 Clock clock) {
        this.properties = properties;
        this.migrations = migrations;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("status", "running");
        migrations.ifAvailable(service -> info.put("schema_version", service.status().currentVersion()));
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
