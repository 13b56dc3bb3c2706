package com.warden.engine.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.warden.engine.domain.metrics.MetricAverages;
import com.warden.engine.domain.metrics.MetricsSnapshot;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcMetricsStore")
class JdbcMetricsStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private JdbcMetricsStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcMetricsStore(MigratedDatabase.create());
    }

    private static MetricsSnapshot snapshot(Instant at, double cpu, double memory, double disk) {
        return new MetricsSnapshot(at, cpu, memory, disk, 1_000, 2_000, 12,
                new MetricsSnapshot.LoadAverage(0.5, 0.4, 0.3));
    }

    @Test
    @DisplayName("should be empty before the first snapshot")
    void shouldBeEmptyInitially() {
        assertThat(store.latest()).isEmpty();
        assertThat(store.averageSince(T0.minus(Duration.ofHours(1)))).isEmpty();
        assertThat(store.since(T0.minus(Duration.ofHours(1)))).isEmpty();
    }

    @Test
    @DisplayName("should return the newest snapshot with every field")
    void shouldReturnLatest() {
        store.append(snapshot(T0, 10, 20, 30));
        store.append(snapshot(T0.plusSeconds(60), 40, 50, 60));

        MetricsSnapshot latest = store.latest().orElseThrow();

        assertThat(latest).isEqualTo(snapshot(T0.plusSeconds(60), 40, 50, 60));
    }

    @Test
    @DisplayName("should average the snapshots inside the window")
    void shouldAverageWindow() {
        store.append(snapshot(T0.minus(Duration.ofHours(2)), 90, 90, 90));
        store.append(snapshot(T0, 10, 20, 30));
        store.append(snapshot(T0.plusSeconds(60), 30, 40, 50));

        MetricAverages averages = store.averageSince(T0).orElseThrow();

        assertThat(averages.samples()).isEqualTo(2);
        assertThat(averages.cpuUsagePct()).isCloseTo(20.0, within(1e-9));
        assertThat(averages.memoryUsagePct()).isCloseTo(30.0, within(1e-9));
        assertThat(averages.diskUsagePct()).isCloseTo(40.0, within(1e-9));
        assertThat(averages.connectionCount()).isCloseTo(12.0, within(1e-9));
    }

    @Test
    @DisplayName("should list the snapshots of a window oldest first")
    void shouldListWindowInOrder() {
        store.append(snapshot(T0.plusSeconds(120), 3, 3, 3));
        store.append(snapshot(T0.minusSeconds(60), 1, 1, 1));
        store.append(snapshot(T0.plusSeconds(60), 2, 2, 2));

        assertThat(store.since(T0))
                .extracting(MetricsSnapshot::cpuUsagePct)
                .containsExactly(2.0, 3.0);
    }
}
