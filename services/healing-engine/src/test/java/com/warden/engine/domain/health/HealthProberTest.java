package com.warden.engine.domain.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.engine.support.InMemoryHealthHistory;
import com.warden.engine.support.MutableClock;
import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.HealthReport;
import com.warden.observability.HealthStatus;
import com.warden.observability.MetricFactory;
import com.warden.observability.testing.InMemoryHealthCheck;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HealthProber")
class HealthProberTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final InMemoryHealthCheck database = new InMemoryHealthCheck("database");
    private final InMemoryHealthCheck queues = new InMemoryHealthCheck("queues");

    private InMemoryHealthHistory history;
    private HealthProber prober;

    @BeforeEach
    void setUp() {
        HealthCheckRegistry registry = new HealthCheckRegistry(HealthCheckRegistry.DEFAULT_TIMEOUT_MS, new MutableClock());
        registry.register("database", database);
        registry.register("queues", queues);
        history = new InMemoryHealthHistory(3);
        prober = new HealthProber(registry, history, new MetricFactory(meters, "warden-test"));
    }

    @Test
    @DisplayName("should aggregate component results and append them to history")
    void shouldAggregateAndRecord() {
        queues.setDegraded("errorRate=0.060");

        HealthReport report = prober.checkHealth();

        assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(report.needsAttention("queues")).isTrue();
        assertThat(report.needsAttention("database")).isFalse();
        assertThat(history.recent(10)).containsExactly(report);
        assertThat(meters.get("warden.health.status").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return the report even when the history write fails")
    void shouldTolerateHistoryFailure() {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register("database", database);
        HealthProber failingHistory = new HealthProber(registry, new HealthHistory() {
            @Override
            public void append(HealthReport report) {
                throw new IllegalStateException("redis down");
            }

            @Override
            public List<HealthReport> recent(int limit) {
                return List.of();
            }

            @Override
            public int capacity() {
                return 10;
            }
        }, new MetricFactory(new SimpleMeterRegistry(), "warden-test"));

        assertThat(failingHistory.checkHealth().status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("should return recent reports newest first")
    void shouldReturnRecentNewestFirst() {
        HealthReport first = prober.checkHealth();
        database.setUnhealthy("connection refused");
        HealthReport second = prober.checkHealth();

        assertThat(prober.recentHealth(2)).containsExactly(second, first);
    }

    @Test
    @DisplayName("should reject a limit outside the history capacity")
    void shouldRejectBadLimit() {
        assertThatThrownBy(() -> prober.recentHealth(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> prober.recentHealth(4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("limit must be between 1 and 3");
    }
}
