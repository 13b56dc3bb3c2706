package com.warden.engine.domain.monitoring;

import com.warden.engine.config.ThresholdProperties;
import com.warden.engine.domain.alert.AlertCategory;
import com.warden.engine.domain.alert.AlertService;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.anomaly.Anomaly;
import com.warden.engine.domain.anomaly.AnomalyDetector;
import com.warden.engine.domain.anomaly.ResourceForecaster;
import com.warden.engine.domain.health.HealthProber;
import com.warden.engine.domain.metrics.ApiMetricsSummary;
import com.warden.engine.domain.metrics.MetricsAggregator;
import com.warden.engine.domain.metrics.MetricsSampler;
import com.warden.engine.domain.metrics.MetricsStore;
import com.warden.engine.domain.metrics.MetricsSummary;
import com.warden.engine.domain.metrics.MetricsUnavailableException;
import com.warden.engine.domain.metrics.Resource;
import com.warden.engine.domain.recovery.RecoveryEngine;
import com.warden.engine.domain.recovery.RecoveryResult;
import com.warden.observability.HealthReport;
import com.warden.observability.HealthStatus;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bodies of the fast and medium lanes.
 *
 * <p>Fast: write a metrics snapshot, check health, run recovery when the system is not healthy
 * and escalate a failed (not skipped) recovery, then run the early warning checks.
 *
 * <p>Medium: anomaly detection on API latency and error rate, then EMA forecasts of resource usage
 * over the last hour. A forecast above its threshold is escalated as a scaling request.
 */
public class ProactiveMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProactiveMonitor.class);

    static final Duration FORECAST_LOOKBACK = Duration.ofHours(1);

    private final MetricsSampler sampler;
    private final MetricsStore metricsStore;
    private final HealthProber prober;
    private final RecoveryEngine recovery;
    private final EarlyWarningMonitor earlyWarnings;
    private final MetricsAggregator aggregator;
    private final AnomalyDetector detector;
    private final ResourceForecaster forecaster;
    private final AlertService alerts;
    private final EscalationService escalation;
    private final ThresholdProperties thresholds;

    public ProactiveMonitor(
            MetricsSampler sampler,
            MetricsStore metricsStore,
            HealthProber prober,
            RecoveryEngine recovery,
            EarlyWarningMonitor earlyWarnings,
            MetricsAggregator aggregator,
            AnomalyDetector detector,
            ResourceForecaster forecaster,
            AlertService alerts,
            EscalationService escalation,
            ThresholdProperties thresholds) {
        this.sampler = sampler;
        this.metricsStore = metricsStore;
        this.prober = prober;
        this.recovery = recovery;
        this.earlyWarnings = earlyWarnings;
        this.aggregator = aggregator;
        this.detector = detector;
        this.forecaster = forecaster;
        this.alerts = alerts;
        this.escalation = escalation;
        this.thresholds = thresholds;
    }

    public void runFastCycle() {
        writeSnapshot();
        HealthReport report = prober.checkHealth();
        if (report.status() != HealthStatus.HEALTHY) {
            recover(report);
        }
        earlyWarnings.runChecks();
    }

    public void runMediumCycle() {
        try {
            detectApiAnomalies(aggregator.getMetricsSummary());
        } catch (MetricsUnavailableException e) {
            log.warn("Skipping anomaly detection: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Anomaly detection failed", e);
            escalation.escalate("Anomaly detection failed", AlertCategory.ANOMALY, null, Map.of(), e);
        }
        for (Resource resource : Resource.values()) {
            try {
                forecast(resource);
            } catch (RuntimeException e) {
                log.error("Forecast of {} failed", resource.wireName(), e);
                escalation.escalate("Resource forecast failed", AlertCategory.PERFORMANCE, resource.wireName(),
                        Map.of(), e);
            }
        }
    }

    /** A skip is neither retried nor escalated. */
    private void recover(HealthReport report) {
        RecoveryResult result;
        try {
            result = recovery.handleSystemDegradation(report);
        } catch (RuntimeException e) {
            log.error("Recovery threw for system status {}", report.status(), e);
            escalation.escalateRecoveryError(report, e);
            return;
        }
        if (!result.success() && !result.isSkipped()) {
            escalation.escalateRecoveryFailure(report, result);
        }
    }

    private void writeSnapshot() {
        try {
            metricsStore.append(sampler.sample());
        } catch (RuntimeException e) {
            log.error("Failed to write metrics snapshot", e);
        }
    }

    private void detectApiAnomalies(MetricsSummary summary) {
        ApiMetricsSummary api = summary.api();
        detector.detect("api.response_time", api.currentResponseTime(), api.responseTimeSeries())
                .ifPresent(anomaly -> raiseAnomaly("Response time anomaly", anomaly));
        detector.detect("api.error_rate", api.currentErrorRate(), api.errorRateSeries())
                .ifPresent(anomaly -> raiseAnomaly("Error rate anomaly", anomaly));
    }

    private void raiseAnomaly(String title, Anomaly anomaly) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("metricType", anomaly.metricType());
        details.put("currentValue", anomaly.currentValue());
        details.put("historicalSeries", anomaly.historicalSeries());
        details.put("detectedAt", anomaly.detectedAt().toString());
        alerts.raise(AlertSeverity.WARNING, AlertCategory.ANOMALY, null, title,
                String.format(Locale.ROOT, "%s deviates from its recent baseline: %.3f",
                        anomaly.metricType(), anomaly.currentValue()),
                details);
    }

    private void forecast(Resource resource) {
        List<Double> series = aggregator.usageSeries(resource, FORECAST_LOOKBACK);
        if (series.isEmpty()) {
            return;
        }
        double predicted = forecaster.forecast(series);
        double threshold = thresholds.usageThreshold(resource);
        if (predicted > threshold) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("resource", resource.wireName());
            context.put("forecast", predicted);
            context.put("threshold", threshold);
            context.put("samples", series.size());
            escalation.escalate(
                    String.format(Locale.ROOT, "Scaling required: %s forecast %.1f%% exceeds %.1f%%",
                            resource.wireName(), predicted, threshold),
                    AlertCategory.PERFORMANCE, resource.wireName(), context, null);
        }
    }
}
