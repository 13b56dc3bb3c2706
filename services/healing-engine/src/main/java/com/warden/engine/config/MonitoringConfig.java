package com.warden.engine.config;

import com.warden.engine.domain.alert.AlertService;
import com.warden.engine.domain.alert.AlertStore;
import com.warden.engine.domain.anomaly.AnomalyDetector;
import com.warden.engine.domain.anomaly.BacklogHistory;
import com.warden.engine.domain.anomaly.ResourceForecaster;
import com.warden.engine.domain.health.HealthProber;
import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.engine.domain.metrics.MetricsAggregator;
import com.warden.engine.domain.metrics.MetricsSampler;
import com.warden.engine.domain.metrics.MetricsStore;
import com.warden.engine.domain.monitoring.DailyHealthReporter;
import com.warden.engine.domain.monitoring.EarlyWarningMonitor;
import com.warden.engine.domain.monitoring.EscalationService;
import com.warden.engine.domain.monitoring.ProactiveMonitor;
import com.warden.engine.domain.notification.NotificationChannel;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.domain.recovery.RecoveryAuditSink;
import com.warden.engine.domain.recovery.RecoveryEngine;
import com.warden.observability.MetricFactory;
import com.warden.observability.SensitiveDataRedactor;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Alerts, escalation and the bodies of the monitoring lanes.
 */
@Configuration
public class MonitoringConfig {

    @Bean
    public AlertService alertService(AlertStore store, ServiceProperties service, Clock clock) {
        return new AlertService(store, service.name(), clock);
    }

    @Bean
    public EscalationService escalationService(NotificationChannel notifications, AlertService alerts,
                                               SensitiveDataRedactor redactor, MetricFactory metrics, Clock clock) {
        return new EscalationService(notifications, alerts, redactor, metrics, clock);
    }

    @Bean
    public EarlyWarningMonitor earlyWarningMonitor(
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
        return new EarlyWarningMonitor(aggregator, detector, backlogHistory, queues, errorLog, alerts, escalation,
                thresholds, detection, clock);
    }

    @Bean
    public ProactiveMonitor proactiveMonitor(
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
        return new ProactiveMonitor(sampler, metricsStore, prober, recovery, earlyWarnings, aggregator, detector,
                forecaster, alerts, escalation, thresholds);
    }

    @Bean
    public DailyHealthReporter dailyHealthReporter(HealthProber prober, MetricsAggregator aggregator,
                                                   AlertService alerts, RecoveryAuditSink auditSink,
                                                   NotificationChannel notifications, Clock clock) {
        return new DailyHealthReporter(prober, aggregator, alerts, auditSink, notifications, clock);
    }
}
