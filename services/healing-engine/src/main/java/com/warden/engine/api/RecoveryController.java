package com.warden.engine.api;

import com.warden.engine.domain.health.HealthProber;
import com.warden.engine.domain.recovery.RecoveryEngine;
import com.warden.engine.domain.recovery.RecoveryResult;
import com.warden.observability.HealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator-triggered recovery against a fresh health check. Answers 409 when another recovery is
 * already running.
 */
@RestController
@RequestMapping("/api/v1/recovery")
public class RecoveryController {

    private static final Logger log = LoggerFactory.getLogger(RecoveryController.class);

    private final HealthProber prober;
    private final RecoveryEngine recovery;

    public RecoveryController(HealthProber prober, RecoveryEngine recovery) {
        this.prober = prober;
        this.recovery = recovery;
    }

    @PostMapping
    public ResponseEntity<RecoveryResponse> trigger() {
        HealthReport report = prober.checkHealth();
        log.info("Operator triggered recovery with system status {}", report.status());
        RecoveryResult result = recovery.handleSystemDegradation(report);
        HttpStatus status = result.isSkipped() ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(new RecoveryResponse(report, result));
    }

    public record RecoveryResponse(HealthReport health, RecoveryResult recovery) {
    }
}
