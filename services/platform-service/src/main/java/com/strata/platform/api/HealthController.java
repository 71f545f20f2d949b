package com.strata.platform.api;

import com.strata.observability.HealthCheckRegistry;
import com.strata.observability.HealthResult;
import com.strata.observability.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Aggregated component health. Answers 503 only when a component is unhealthy.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final HealthCheckRegistry registry;

    public HealthController(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResult> health() {
        HealthResult result = registry.checkAll();
        HttpStatus status = result.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
