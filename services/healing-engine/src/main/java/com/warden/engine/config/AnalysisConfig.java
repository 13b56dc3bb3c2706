package com.warden.engine.config;

import com.warden.engine.domain.anomaly.AnomalyDetector;
import com.warden.engine.domain.anomaly.BacklogHistory;
import com.warden.engine.domain.anomaly.ResourceForecaster;
import com.warden.engine.domain.metrics.ApiMetricsStore;
import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.engine.domain.metrics.MetricsAggregator;
import com.warden.engine.domain.metrics.MetricsSampler;
import com.warden.engine.domain.metrics.MetricsStore;
import com.warden.engine.domain.metrics.ResourceUsageProvider;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.infrastructure.system.SystemMetricsSampler;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics sampling, aggregation and anomaly detection.
 */
@Configuration
public class AnalysisConfig {

    @Bean
    public MetricsSampler metricsSampler(ResourceUsageProvider usage, ProbeProperties probes, Clock clock) {
        return new SystemMetricsSampler(usage, Path.of(probes.diskPath()), clock);
    }

    @Bean
    public MetricsAggregator metricsAggregator(
            MetricsStore metricsStore,
            ApiMetricsStore apiMetricsStore,
            ErrorLogStore errorLogStore,
            JobQueues queues,
            @Qualifier(ObservabilityConfig.QUEUE_SAMPLING_EXECUTOR) Executor executor,
            ProbeProperties probes,
            Clock clock) {
        return new MetricsAggregator(metricsStore, apiMetricsStore, errorLogStore, queues, executor,
                Duration.ofMillis(probes.timeoutMs()), clock);
    }

    @Bean
    public BacklogHistory backlogHistory(DetectionProperties detection) {
        return new BacklogHistory(detection.backlogHistorySize());
    }

    @Bean
    public AnomalyDetector anomalyDetector(DetectionProperties detection, ThresholdProperties thresholds,
                                           BacklogHistory backlogHistory, JobQueues queues, Clock clock) {
        return new AnomalyDetector(detection, thresholds.queueLength(), backlogHistory, queues, clock);
    }

    @Bean
    public ResourceForecaster resourceForecaster(DetectionProperties detection) {
        return new ResourceForecaster(detection.forecastAlpha());
    }
}
