package com.warden.engine.api;

import com.warden.engine.domain.health.HealthProber;
import com.warden.observability.HealthReport;
import com.warden.observability.HealthStatus;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Fresh health checks and the recent health history. An unhealthy system answers 503 so load
 * balancers can act on the status code alone.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthProber prober;

    public HealthController(HealthProber prober) {
        this.prober = prober;
    }

    @GetMapping
    public ResponseEntity<HealthReport> health() {
        HealthReport report = prober.checkHealth();
        HttpStatus status = report.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/history")
    public List<HealthReport> history(@RequestParam(defaultValue = "10") int limit) {
        return prober.recentHealth(limit);
    }
}
