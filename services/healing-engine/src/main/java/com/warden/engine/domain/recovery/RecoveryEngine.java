package com.warden.engine.domain.recovery;

import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.notification.Notification;
import com.warden.engine.domain.notification.NotificationChannel;
import com.warden.engine.domain.notification.ReportPayloads;
import com.warden.observability.HealthReport;
import com.warden.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-flight remediation of a degraded system.
 *
 * <p>Areas run in the order given, and only for components the trigger report marks as needing
 * attention. Steps never throw; anything else that escapes an area aborts the run. The guard is
 * released before the attempt is audited and notified.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    static final String METRIC_ATTEMPTS = "warden.recovery.attempts";

    private final RecoveryGuard guard;
    private final List<RemediationArea> areas;
    private final RecoveryAuditSink auditSink;
    private final NotificationChannel notifications;
    private final Clock clock;
    private final Counter skippedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;

    public RecoveryEngine(
            RecoveryGuard guard,
            List<RemediationArea> areas,
            RecoveryAuditSink auditSink,
            NotificationChannel notifications,
            MetricFactory metrics,
            Clock clock) {
        this.guard = guard;
        this.areas = List.copyOf(areas);
        this.auditSink = auditSink;
        this.notifications = notifications;
        this.clock = clock;
        this.skippedCounter = attemptCounter(metrics, RecoveryResult.SKIPPED);
        this.completedCounter = attemptCounter(metrics, RecoveryResult.COMPLETED);
        this.failedCounter = attemptCounter(metrics, RecoveryResult.FAILED);
    }

    /**
     * Remediates every area whose component is not healthy in {@code trigger}. Returns a skipped
     * result immediately when another recovery holds the guard.
     */
    public RecoveryResult handleSystemDegradation(HealthReport trigger) {
        Optional<RecoveryGuard.Permit> permit = guard.tryAcquire();
        if (permit.isEmpty()) {
            log.info("Recovery already in progress, skipping trigger with status {}", trigger.status());
            skippedCounter.increment();
            return RecoveryResult.skipped();
        }

        Instant attemptedAt = clock.instant();
        RecoveryResult result;
        try (RecoveryGuard.Permit held = permit.get()) {
            log.info("Starting recovery for system status {}", trigger.status());
            result = remediate(trigger);
        } catch (RuntimeException e) {
            log.error("Recovery aborted", e);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put(RecoveryResult.STATUS, RecoveryResult.FAILED);
            details.put("triggerStatus", trigger.status().wireName());
            details.put("error", String.valueOf(e.getMessage()));
            result = new RecoveryResult(false, List.of("Recovery aborted: " + e.getMessage()), details);
        }

        (result.success() ? completedCounter : failedCounter).increment();
        log.info("Recovery {} with {} actions", result.status(), result.actionsTaken().size());
        audit(trigger, result, attemptedAt);
        notifyOutcome(trigger, result, attemptedAt);
        return result;
    }

    /** Whether a recovery is running right now. */
    public boolean isRecoveryInProgress() {
        return guard.isHeld();
    }

    private RecoveryResult remediate(HealthReport trigger) {
        boolean success = true;
        List<String> actions = new ArrayList<>();
        Map<String, Object> areaOutcomes = new LinkedHashMap<>();
        for (RemediationArea area : areas) {
            if (!trigger.needsAttention(area.component())) {
                continue;
            }
            AreaOutcome outcome = area.remediate(trigger);
            success &= outcome.success();
            actions.addAll(outcome.actions());
            areaOutcomes.put(area.component(), outcome.success() ? "remediated" : "failed");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(RecoveryResult.STATUS, success ? RecoveryResult.COMPLETED : RecoveryResult.FAILED);
        details.put("triggerStatus", trigger.status().wireName());
        details.put("areas", areaOutcomes);
        return new RecoveryResult(success, actions, details);
    }

    private void audit(HealthReport trigger, RecoveryResult result, Instant attemptedAt) {
        try {
            auditSink.record(new RecoveryAttempt(
                    trigger, result.actionsTaken(), result.success(), result.status(), attemptedAt));
        } catch (RuntimeException e) {
            log.error("Failed to record recovery attempt", e);
        }
    }

    private void notifyOutcome(HealthReport trigger, RecoveryResult result, Instant attemptedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("trigger", ReportPayloads.healthReport(trigger));
        payload.put("actionsTaken", result.actionsTaken());
        payload.put("success", result.success());
        payload.put("attemptedAt", attemptedAt.toString());
        String subject = "System Recovery Attempt - " + (result.success() ? "Successful" : "Failed");
        try {
            notifications.send(new Notification(
                    subject, result.success() ? AlertSeverity.INFO : AlertSeverity.ERROR, payload, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to send recovery notification", e);
        }
    }

    private static Counter attemptCounter(MetricFactory metrics, String outcome) {
        return metrics.counter(METRIC_ATTEMPTS, "Recovery attempts by outcome", "outcome", outcome);
    }
}
