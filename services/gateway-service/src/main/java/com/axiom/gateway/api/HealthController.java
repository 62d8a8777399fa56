package com.axiom.gateway.api;

import com.axiom.observability.HealthCheckRegistry;
import com.axiom.observability.HealthResult;
import com.axiom.observability.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Deep health: probes the database and reports each dependency breaker. Degraded still answers
 * 200; only an unhealthy component turns the response into 503.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckRegistry registry;

    public HealthController(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/deep")
    public ResponseEntity<HealthResult> deep() {
        HealthResult result = registry.checkAll();
        HttpStatus status = result.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
