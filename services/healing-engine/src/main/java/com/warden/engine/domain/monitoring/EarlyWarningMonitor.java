package com.warden.engine.domain.monitoring;

import com.warden.engine.config.DetectionProperties;
import com.warden.engine.config.ThresholdProperties;
import com.warden.engine.domain.alert.AlertCategory;
import com.warden.engine.domain.alert.AlertService;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.anomaly.AnomalyDetector;
import com.warden.engine.domain.anomaly.BacklogHistory;
import com.warden.engine.domain.anomaly.QueuePattern;
import com.warden.engine.domain.metrics.ErrorLogEntry;
import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.engine.domain.metrics.MetricsAggregator;
import com.warden.engine.domain.metrics.MetricsSummary;
import com.warden.engine.domain.metrics.MetricsUnavailableException;
import com.warden.engine.domain.metrics.PerformanceWindow;
import com.warden.engine.domain.metrics.Resource;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.domain.queue.QueueMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Threshold checks run on every fast tick: resource usage, queue backlog and error rate, and
 * recurring error messages.
 *
 * <p>Checks are independent. A check or handler that throws is escalated and the remaining checks
 * still run.
 */
public class EarlyWarningMonitor {

    private static final Logger log = LoggerFactory.getLogger(EarlyWarningMonitor.class);

    private final MetricsAggregator aggregator;
    private final AnomalyDetector detector;
    private final BacklogHistory backlogHistory;
    private final JobQueues queues;
    private final ErrorLogStore errorLog;
    private final AlertService alerts;
    private final EscalationService escalation;
    private final ThresholdProperties thresholds;
    private final DetectionProperties detection;
    private final Clock clock;

    public EarlyWarningMonitor(
            MetricsAggregator aggregator,
            AnomalyDetector detector,
            BacklogHistory backlogHistory,
            JobQueues queues,
            ErrorLogStore errorLog,
            AlertService alerts,
            EscalationService escalation,
            ThresholdProperties thresholds,
            DetectionProperties detection,
            Clock clock) {
        this.aggregator = aggregator;
        this.detector = detector;
        this.backlogHistory = backlogHistory;
        this.queues = queues;
        this.errorLog = errorLog;
        this.alerts = alerts;
        this.escalation = escalation;
        this.thresholds = thresholds;
        this.detection = detection;
        this.clock = clock;
    }

    /** Runs every check. */
    public void runChecks() {
        isolated("resource thresholds", null, this::checkResourceThresholds);
        checkQueueThresholds();
        isolated("error patterns", null, this::analyzeErrorPatterns);
    }

    void checkResourceThresholds() {
        MetricsSummary summary;
        try {
            summary = aggregator.getPerformanceMetrics(PerformanceWindow.MINUTE);
        } catch (MetricsUnavailableException e) {
            log.warn("Skipping resource threshold check: {}", e.getMessage());
            return;
        }
        for (Resource resource : Resource.values()) {
            double current = summary.of(resource).current();
            double threshold = thresholds.usageThreshold(resource);
            if (current > threshold) {
                String name = resource.wireName().toUpperCase(Locale.ROOT);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("current", current);
                details.put("threshold", threshold);
                details.put("trend", summary.of(resource).trend());
                alerts.raise(AlertSeverity.WARNING, AlertCategory.PERFORMANCE, resource.wireName(),
                        "High " + name + " usage",
                        String.format(Locale.ROOT, "%s usage is %.1f%% (threshold %.1f%%)", name, current, threshold),
                        details);
            }
        }
    }

    void checkQueueThresholds() {
        Map<String, QueueMetrics> metrics;
        try {
            metrics = aggregator.getQueueMetrics();
        } catch (RuntimeException e) {
            log.error("Queue threshold check failed", e);
            escalation.escalate("Early warning check failed: queue thresholds", AlertCategory.QUEUE, null,
                    Map.of(), e);
            return;
        }
        metrics.forEach((queue, stats) -> {
            backlogHistory.record(queue, stats.waiting());
            if (stats.waiting() > thresholds.queueLength()) {
                isolated("queue backlog", queue, () -> handleQueueBacklog(queue, stats));
            }
            if (stats.errorRate() > thresholds.errorRate()) {
                isolated("queue error rate", queue, () -> handleQueueErrorRate(queue, stats));
            }
        });
    }

    void analyzeErrorPatterns() {
        List<ErrorLogEntry> recent = errorLog.since(
                clock.instant().minus(Duration.ofMinutes(detection.errorPatternWindowMinutes())));
        if (recent.size() < detection.errorPatternMinErrors()) {
            return;
        }
        Map<String, Long> byMessage = recent.stream()
                .collect(Collectors.groupingBy(ErrorLogEntry::message, Collectors.counting()));
        Map.Entry<String, Long> top = byMessage.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        double share = (double) top.getValue() / recent.size();
        if (share <= detection.errorPatternSignificance()) {
            return;
        }
        Map<String, Long> byComponent = recent.stream()
                .filter(entry -> entry.message().equals(top.getKey()))
                .collect(Collectors.groupingBy(ErrorLogEntry::component, Collectors.counting()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pattern", top.getKey());
        details.put("occurrences", top.getValue());
        details.put("totalErrors", recent.size());
        details.put("share", share);
        details.put("components", byComponent);
        alerts.raise(AlertSeverity.WARNING, AlertCategory.SYSTEM, null, "Recurring error pattern",
                String.format(Locale.ROOT, "%d of %d recent errors share the message: %s",
                        top.getValue(), recent.size(), top.getKey()),
                details);
    }

    private void handleQueueBacklog(String queue, QueueMetrics stats) {
        alerts.raise(AlertSeverity.WARNING, AlertCategory.QUEUE, queue, "Queue backlog",
                "Queue " + queue + " has " + stats.waiting() + " waiting jobs (threshold "
                        + thresholds.queueLength() + ")",
                stats.toDetail());

        QueuePattern pattern = detector.analyzeQueuePatterns(queue);
        if (pattern.systematic() && pattern.scalingRecommended()) {
            queues.require(queue).scaleWorkers(pattern.recommendedWorkers());
            log.info("Scaled queue {} from {} to {} workers", queue, pattern.currentWorkers(),
                    pattern.recommendedWorkers());
            alerts.raise(AlertSeverity.INFO, AlertCategory.QUEUE, queue, "Queue workers scaled",
                    "Scaled " + queue + " from " + pattern.currentWorkers() + " to "
                            + pattern.recommendedWorkers() + " workers after a systematic backlog",
                    Map.of("currentWorkers", pattern.currentWorkers(),
                            "recommendedWorkers", pattern.recommendedWorkers()));
        }
    }

    private void handleQueueErrorRate(String queue, QueueMetrics stats) {
        alerts.raise(AlertSeverity.ERROR, AlertCategory.QUEUE, queue, "High queue error rate",
                String.format(Locale.ROOT, "Queue %s error rate is %.1f%% (threshold %.1f%%)",
                        queue, stats.errorRate() * 100, thresholds.errorRate() * 100),
                stats.toDetail());
    }

    private void isolated(String check, String component, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            log.error("Early warning check '{}' failed", check, e);
            escalation.escalate("Early warning check failed: " + check, AlertCategory.SYSTEM, component,
                    Map.of(), e);
        }
    }
}
