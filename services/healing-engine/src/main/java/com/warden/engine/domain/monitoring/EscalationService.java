package com.warden.engine.domain.monitoring;

import com.warden.engine.domain.alert.AlertCategory;
import com.warden.engine.domain.alert.AlertService;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.notification.Notification;
import com.warden.engine.domain.notification.NotificationChannel;
import com.warden.engine.domain.notification.ReportPayloads;
import com.warden.engine.domain.recovery.RecoveryResult;
import com.warden.observability.HealthReport;
import com.warden.observability.MetricFactory;
import com.warden.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands issues the engine could not resolve to administrators: an urgent notification plus a
 * matching critical alert. Payloads are redacted. Never throws.
 */
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    static final String SUBJECT_PREFIX = "URGENT: ";

    private final NotificationChannel notifications;
    private final AlertService alerts;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;
    private final Counter escalations;

    public EscalationService(NotificationChannel notifications, AlertService alerts,
                             SensitiveDataRedactor redactor, MetricFactory metrics, Clock clock) {
        this.notifications = notifications;
        this.alerts = alerts;
        this.redactor = redactor;
        this.clock = clock;
        this.escalations = metrics.counter("warden.escalations", "Issues escalated to administrators");
    }

    /** Recovery ran and reported failure. */
    public void escalateRecoveryFailure(HealthReport trigger, RecoveryResult result) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("trigger", ReportPayloads.healthReport(trigger));
        context.put("attemptedActions", result.actionsTaken());
        context.put("recovery", result.details());
        escalate("Automatic recovery failed", AlertCategory.RECOVERY, null, context, null);
    }

    /** Recovery could not be run at all. */
    public void escalateRecoveryError(HealthReport trigger, Throwable error) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("trigger", ReportPayloads.healthReport(trigger));
        escalate("Automatic recovery failed", AlertCategory.RECOVERY, null, context, error);
    }

    /**
     * Escalates an arbitrary issue.
     *
     * @param component component or queue concerned, may be null
     * @param error cause, may be null
     */
    public void escalate(String issue, AlertCategory category, String component,
                         Map<String, Object> context, Throwable error) {
        try {
            escalations.increment();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("issue", issue);
            payload.put("timestamp", clock.instant().toString());
            if (component != null) {
                payload.put("component", component);
            }
            payload.put("context", context == null ? Map.of() : context);
            if (error != null) {
                payload.put("error", describe(error));
            }
            Map<String, Object> redacted = redactor.redact(payload);
            log.error("Escalating issue: {}", issue);

            sendNotification(issue, redacted);
            raiseAlert(issue, category, component, redacted, error);
        } catch (RuntimeException e) {
            log.error("Escalation of '{}' failed", issue, e);
        }
    }

    private void sendNotification(String issue, Map<String, Object> payload) {
        try {
            notifications.send(new Notification(SUBJECT_PREFIX + issue, AlertSeverity.CRITICAL, payload, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to send escalation notification for '{}'", issue, e);
        }
    }

    private void raiseAlert(String issue, AlertCategory category, String component,
                            Map<String, Object> payload, Throwable error) {
        try {
            String message = error == null ? issue : redactor.redactText(describe(error));
            alerts.raise(AlertSeverity.CRITICAL, category, component, issue, message, payload);
        } catch (RuntimeException e) {
            log.error("Failed to store escalation alert for '{}'", issue, e);
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
