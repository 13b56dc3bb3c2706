package com.warden.engine.domain.monitoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.warden.engine.domain.alert.Alert;
import com.warden.engine.domain.alert.AlertCategory;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.metrics.ErrorLogEntry;
import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.engine.domain.metrics.MetricsAggregator;
import com.warden.engine.domain.metrics.MetricsUnavailableException;
import com.warden.engine.domain.metrics.PerformanceWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EarlyWarningMonitor")
class EarlyWarningMonitorTest {

    private MonitoringHarness harness;

    @BeforeEach
    void setUp() {
        harness = new MonitoringHarness();
    }

    private List<String> escalatedSubjects() {
        return harness.notifications.withSubjectStartingWith(EscalationService.SUBJECT_PREFIX).stream()
                .map(n -> n.subject())
                .toList();
    }

    @Nested
    @DisplayName("Resource thresholds")
    class ResourceThresholds {

        @Test
        @DisplayName("should warn about a resource above its threshold")
        void shouldWarnAboutHighCpu() {
            harness.cpuPct = 93.5;
            harness.metricsStore.append(harness.sample());

            harness.earlyWarnings.runChecks();

            Alert alert = harness.alertStore.withTitle("High CPU usage").get(0);
            assertThat(alert.severity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(alert.category()).isEqualTo(AlertCategory.PERFORMANCE);
            assertThat(alert.message()).isEqualTo("CPU usage is 93.5% (threshold 80.0%)");
            assertThat(harness.alertStore.withTitle("High MEMORY usage")).isEmpty();
        }

        @Test
        @DisplayName("should skip the check quietly before any snapshot exists")
        void shouldSkipWithoutSnapshot() {
            harness.earlyWarnings.runChecks();

            assertThat(harness.alertStore.all()).isEmpty();
            assertThat(escalatedSubjects()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Queue thresholds")
    class QueueThresholds {

        @Test
        @DisplayName("should warn about a backlog and scale workers once it is systematic")
        void shouldScaleSystematicBacklog() {
            for (int i = 0; i < 1001; i++) {
                harness.email.enqueue();
            }

            harness.earlyWarnings.runChecks();
            harness.earlyWarnings.runChecks();
            assertThat(harness.alertStore.withTitle("Queue workers scaled")).isEmpty();
            harness.earlyWarnings.runChecks();

            assertThat(harness.alertStore.withTitle("Queue backlog")).hasSize(3);
            assertThat(harness.alertStore.withTitle("Queue workers scaled")).hasSize(1);
            assertThat(harness.email.workerCount()).isEqualTo(5);
            assertThat(harness.files.workerCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should alert on a queue error rate above the threshold")
        void shouldAlertOnErrorRate() {
            MonitoringHarness.finishJobs(harness.files, 90, 10);

            harness.earlyWarnings.runChecks();

            Alert alert = harness.alertStore.withTitle("High queue error rate").get(0);
            assertThat(alert.severity()).isEqualTo(AlertSeverity.ERROR);
            assertThat(alert.component()).isEqualTo("file-processing");
            assertThat(alert.message()).isEqualTo("Queue file-processing error rate is 10.0% (threshold 5.0%)");
        }

        @Test
        @DisplayName("should escalate when queue metrics cannot be read")
        void shouldEscalateUnreadableQueues() {
            MetricsAggregator aggregator = mock(MetricsAggregator.class);
            when(aggregator.getPerformanceMetrics(PerformanceWindow.MINUTE))
                    .thenThrow(new MetricsUnavailableException("no data"));
            when(aggregator.getQueueMetrics()).thenThrow(new MetricsUnavailableException("Queue metrics unavailable"));
            EarlyWarningMonitor monitor = new EarlyWarningMonitor(aggregator, harness.detector, harness.backlog,
                    harness.queues, harness.errorLog, harness.alerts, harness.escalation, harness.thresholds,
                    harness.detection, harness.clock);

            monitor.runChecks();

            assertThat(escalatedSubjects()).containsExactly("URGENT: Early warning check failed: queue thresholds");
        }
    }

    @Nested
    @DisplayName("Error patterns")
    class ErrorPatterns {

        private void errors(String message, int count) {
            for (int i = 0; i < count; i++) {
                harness.errorLog.record(new ErrorLogEntry("http", message, harness.clock.instant()));
            }
        }

        @Test
        @DisplayName("should warn when one message dominates recent errors")
        void shouldDetectRecurringMessage() {
            errors("Connection pool exhausted", 8);
            errors("Timeout", 2);

            harness.earlyWarnings.runChecks();

            Alert alert = harness.alertStore.withTitle("Recurring error pattern").get(0);
            assertThat(alert.details()).containsEntry("pattern", "Connection pool exhausted")
                    .containsEntry("occurrences", 8L)
                    .containsEntry("components", Map.of("http", 8L));
        }

        @Test
        @DisplayName("should ignore too few errors or errors without a dominant message")
        void shouldIgnoreNoise() {
            errors("Connection pool exhausted", 9);
            harness.earlyWarnings.runChecks();
            assertThat(harness.alertStore.withTitle("Recurring error pattern")).isEmpty();

            errors("Timeout", 4);
            harness.earlyWarnings.runChecks();
            assertThat(harness.alertStore.withTitle("Recurring error pattern")).isEmpty();
        }

        @Test
        @DisplayName("should only look at the recent window")
        void shouldIgnoreOldErrors() {
            errors("Connection pool exhausted", 10);
            harness.clock.advance(Duration.ofMinutes(6));

            harness.earlyWarnings.runChecks();

            assertThat(harness.alertStore.withTitle("Recurring error pattern")).isEmpty();
        }
    }

    @Test
    @DisplayName("should escalate a failing check and still run the others")
    void shouldIsolateFailingCheck() {
        ErrorLogStore broken = new ErrorLogStore() {
            @Override
            public void record(ErrorLogEntry entry) {
            }

            @Override
            public List<ErrorLogEntry> since(Instant since) {
                throw new IllegalStateException("error log unavailable");
            }

            @Override
            public List<ErrorLogEntry> between(String component, Instant from, Instant to) {
                throw new IllegalStateException("error log unavailable");
            }
        };
        harness.cpuPct = 99;
        harness.metricsStore.append(harness.sample());
        EarlyWarningMonitor monitor = new EarlyWarningMonitor(harness.aggregator, harness.detector, harness.backlog,
                harness.queues, broken, harness.alerts, harness.escalation, harness.thresholds, harness.detection,
                harness.clock);

        monitor.runChecks();

        assertThat(harness.alertStore.withTitle("High CPU usage")).hasSize(1);
        assertThat(escalatedSubjects()).containsExactly("URGENT: Early warning check failed: error patterns");
    }
}
