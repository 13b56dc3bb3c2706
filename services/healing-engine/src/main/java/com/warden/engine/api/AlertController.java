package com.warden.engine.api;

import com.warden.engine.domain.alert.Alert;
import com.warden.engine.domain.alert.AlertFilter;
import com.warden.engine.domain.alert.AlertPage;
import com.warden.engine.domain.alert.AlertService;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.alert.AlertStatus;
import jakarta.validation.Valid;
import java.util.Locale;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lists and resolves system alerts. Status and severity filters are case-insensitive.
 */
@RestController
@RequestMapping("/api/v1/alerts")
public class AlertController {

    private final AlertService alerts;

    public AlertController(AlertService alerts) {
        this.alerts = alerts;
    }

    @GetMapping
    public AlertPage list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "10") int limit) {
        return alerts.getAlerts(new AlertFilter(
                status == null ? null : AlertStatus.valueOf(status.toUpperCase(Locale.ROOT)),
                severity == null ? null : AlertSeverity.valueOf(severity.toUpperCase(Locale.ROOT)),
                limit));
    }

    @PutMapping("/{id}/resolve")
    public Alert resolve(@PathVariable String id, @Valid @RequestBody ResolveAlertRequest request) {
        return alerts.resolve(id, request.resolvedBy(), request.resolutionMessage());
    }
}
