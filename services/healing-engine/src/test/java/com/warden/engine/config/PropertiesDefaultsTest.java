package com.warden.engine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.engine.domain.metrics.Resource;
import com.warden.engine.domain.queue.QueueClass;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Engine properties")
class PropertiesDefaultsTest {

    @Nested
    @DisplayName("ServiceProperties")
    class Service {

        @Test
        @DisplayName("defaults environment to 'development' when null")
        void defaultsEnvironment() {
            var props = new ServiceProperties("healing-engine", null, null);
            assertThat(props.environment()).isEqualTo("development");
            assertThat(props.description()).isEmpty();
        }
    }

    @Nested
    @DisplayName("ThresholdProperties")
    class Thresholds {

        @Test
        @DisplayName("fills every unset threshold")
        void fillsDefaults() {
            var props = ThresholdProperties.defaults();
            assertThat(props.cpuUsage()).isEqualTo(80);
            assertThat(props.memoryUsage()).isEqualTo(85);
            assertThat(props.diskUsage()).isEqualTo(85);
            assertThat(props.queueLength()).isEqualTo(1000);
            assertThat(props.errorRate()).isEqualTo(0.05);
        }

        @Test
        @DisplayName("maps each resource to its threshold")
        void mapsResources() {
            var props = new ThresholdProperties(70, 75, 95, 10, 0.1);
            assertThat(props.usageThreshold(Resource.CPU)).isEqualTo(70);
            assertThat(props.usageThreshold(Resource.MEMORY)).isEqualTo(75);
            assertThat(props.usageThreshold(Resource.DISK)).isEqualTo(95);
        }
    }

    @Nested
    @DisplayName("ProbeProperties")
    class Probes {

        @Test
        @DisplayName("fills the probe bands")
        void fillsDefaults() {
            var props = ProbeProperties.defaults();
            assertThat(props.timeoutMs()).isEqualTo(5000);
            assertThat(props.memorySoftPct()).isEqualTo(75);
            assertThat(props.memoryHardPct()).isEqualTo(90);
            assertThat(props.queueFailureRate()).isEqualTo(0.1);
            assertThat(props.queueDelayed()).isEqualTo(100);
            assertThat(props.degradedFactor()).isEqualTo(0.5);
            assertThat(props.diskPath()).isEqualTo("/");
            assertThat(props.isBandOrderValid()).isTrue();
        }

        @Test
        @DisplayName("flags a soft band above the hard band")
        void flagsInvertedBands() {
            var props = new ProbeProperties(0, 95, 90, 0, 0, 0, 0, 0, 0, null, 0);
            assertThat(props.isBandOrderValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("DetectionProperties")
    class Detection {

        @Test
        @DisplayName("fills the detection defaults")
        void fillsDefaults() {
            var props = DetectionProperties.defaults();
            assertThat(props.sigmaThreshold()).isEqualTo(2.0);
            assertThat(props.forecastAlpha()).isEqualTo(0.2);
            assertThat(props.backlogMinSamples()).isEqualTo(3);
            assertThat(props.backlogHistorySize()).isEqualTo(10);
            assertThat(props.maxWorkers()).isEqualTo(10);
        }

        @Test
        @DisplayName("replaces an out-of-range smoothing factor")
        void replacesInvalidAlpha() {
            var props = new DetectionProperties(0, 1.5, 0, 0, 0, 0, 0, 0, 0, 0);
            assertThat(props.forecastAlpha()).isEqualTo(0.2);
        }
    }

    @Nested
    @DisplayName("RemediationProperties")
    class Remediation {

        @Test
        @DisplayName("picks the staleness threshold by queue class")
        void picksStuckThreshold() {
            var props = RemediationProperties.defaults();
            assertThat(props.stuckThreshold(QueueClass.SHORT)).isEqualTo(Duration.ofMinutes(5));
            assertThat(props.stuckThreshold(QueueClass.LONG)).isEqualTo(Duration.ofHours(1));
            assertThat(props.logRetention()).isEqualTo(Duration.ofDays(7));
            assertThat(props.compressEnabled()).isFalse();
        }
    }

    @Nested
    @DisplayName("SchedulerProperties")
    class Scheduler {

        @Test
        @DisplayName("fills the lane cadences")
        void fillsDefaults() {
            var props = new SchedulerProperties(null, null, null, null, null, 0);
            assertThat(props.enabled()).isTrue();
            assertThat(props.fastInterval()).isEqualTo(Duration.ofMinutes(1));
            assertThat(props.mediumInterval()).isEqualTo(Duration.ofMinutes(10));
            assertThat(props.dailyCron()).isEqualTo("0 0 6 * * *");
            assertThat(props.poolSize()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("StorageProperties")
    class Storage {

        @Test
        @DisplayName("requires a bucket when enabled")
        void requiresBucket() {
            assertThatThrownBy(() -> new StorageProperties(true, " ", null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("warden.storage.bucket");
            assertThat(new StorageProperties(false, null, null, null).region()).isEqualTo("us-east-1");
        }
    }

    @Nested
    @DisplayName("QueueProperties")
    class Queues {

        @Test
        @DisplayName("defaults to the file-processing and email queues")
        void defaultsQueues() {
            var props = new QueueProperties(null);
            assertThat(props.definitions())
                    .extracting(QueueProperties.QueueDefinition::name)
                    .containsExactly("file-processing", "email");
        }

        @Test
        @DisplayName("fills class and workers of a definition")
        void fillsDefinition() {
            var props = new QueueProperties(List.of(new QueueProperties.QueueDefinition("sms", null, 0)));
            assertThat(props.definitions().get(0).queueClass()).isEqualTo(QueueClass.SHORT);
            assertThat(props.definitions().get(0).workers()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("NotificationProperties")
    class Notification {

        @Test
        @DisplayName("treats a blank webhook as unconfigured")
        void detectsWebhook() {
            assertThat(new NotificationProperties("", null, null).webhookConfigured()).isFalse();
            assertThat(new NotificationProperties("https://hooks.example.com", null, null).webhookConfigured())
                    .isTrue();
        }
    }
}
