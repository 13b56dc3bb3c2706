package com.warden.engine.domain.monitoring;

import com.warden.engine.domain.alert.AlertService;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.health.HealthProber;
import com.warden.engine.domain.metrics.MetricsAggregator;
import com.warden.engine.domain.metrics.MetricsUnavailableException;
import com.warden.engine.domain.notification.Notification;
import com.warden.engine.domain.notification.NotificationChannel;
import com.warden.engine.domain.notification.ReportPayloads;
import com.warden.engine.domain.recovery.RecoveryAttempt;
import com.warden.engine.domain.recovery.RecoveryAuditSink;
import com.warden.observability.HealthReport;
import com.warden.observability.HealthStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and sends the daily system health report.
 */
public class DailyHealthReporter {

    private static final Logger log = LoggerFactory.getLogger(DailyHealthReporter.class);

    static final String SUBJECT = "Daily System Health Report";
    static final Duration LOOKBACK = Duration.ofDays(1);

    private final HealthProber prober;
    private final MetricsAggregator aggregator;
    private final AlertService alerts;
    private final RecoveryAuditSink auditSink;
    private final NotificationChannel notifications;
    private final Clock clock;

    public DailyHealthReporter(HealthProber prober, MetricsAggregator aggregator, AlertService alerts,
                               RecoveryAuditSink auditSink, NotificationChannel notifications, Clock clock) {
        this.prober = prober;
        this.aggregator = aggregator;
        this.alerts = alerts;
        this.auditSink = auditSink;
        this.notifications = notifications;
        this.clock = clock;
    }

    /**
     * Sends the report. The metrics section is omitted when no snapshot exists.
     *
     * @throws com.warden.engine.domain.notification.NotificationException if the report cannot be sent
     */
    public void sendReport() {
        Instant now = clock.instant();
        HealthReport health = prober.checkHealth();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("generatedAt", now.toString());
        payload.put("health", ReportPayloads.healthReport(health));
        try {
            payload.put("metrics", aggregator.getMetricsSummary());
        } catch (MetricsUnavailableException e) {
            log.warn("Daily report without metrics: {}", e.getMessage());
        }

        Map<String, Object> alertCounts = new LinkedHashMap<>();
        alerts.activeCounts().forEach((severity, count) -> alertCounts.put(severity.name(), count));
        payload.put("activeAlerts", alertCounts);

        List<Map<String, Object>> attempts = new ArrayList<>();
        for (RecoveryAttempt attempt : auditSink.since(now.minus(LOOKBACK))) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("attemptedAt", attempt.attemptedAt().toString());
            entry.put("triggerStatus", attempt.trigger().status().wireName());
            entry.put("outcome", attempt.outcome());
            entry.put("actions", attempt.actions());
            attempts.add(entry);
        }
        payload.put("recoveryAttempts", attempts);

        AlertSeverity severity = health.status() == HealthStatus.HEALTHY ? AlertSeverity.INFO : AlertSeverity.WARNING;
        notifications.send(new Notification(SUBJECT, severity, payload, now));
        log.info("Daily health report sent: status {}, {} recovery attempts", health.status(), attempts.size());
    }
}
