package com.warden.engine.domain.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ApiMetricsSummary")
class ApiMetricsSummaryTest {

    private static final Instant START = Instant.parse("2026-03-01T11:00:00Z");
    private static final Instant END = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration BUCKET = Duration.ofMinutes(5);

    private static ApiCall call(int minute, int status, long latencyMs) {
        return new ApiCall("/api/v1/health", "GET", status, latencyMs, START.plus(Duration.ofMinutes(minute)));
    }

    @Test
    @DisplayName("should summarize an empty window as zeros")
    void shouldSummarizeEmptyWindow() {
        ApiMetricsSummary summary = ApiMetricsSummary.from(List.of(), START, END, BUCKET);

        assertThat(summary.totalRequests()).isZero();
        assertThat(summary.responseTimeSeries()).isEmpty();
        assertThat(summary.statusDistribution()).isEmpty();
    }

    @Test
    @DisplayName("should compute totals, percentiles and the status distribution")
    void shouldComputeTotals() {
        ApiMetricsSummary summary = ApiMetricsSummary.from(List.of(
                call(1, 200, 100), call(2, 200, 200), call(7, 500, 300), call(59, 200, 1000)), START, END, BUCKET);

        assertThat(summary.totalRequests()).isEqualTo(4);
        assertThat(summary.averageResponseTimeMs()).isEqualTo(400.0);
        assertThat(summary.p95ResponseTimeMs()).isEqualTo(1000.0);
        assertThat(summary.errorRate()).isEqualTo(0.25);
        assertThat(summary.statusDistribution()).isEqualTo(Map.of("2xx", 3L, "5xx", 1L));
    }

    @Test
    @DisplayName("should split the latest bucket from the baseline series")
    void shouldSplitCurrentFromBaseline() {
        ApiMetricsSummary summary = ApiMetricsSummary.from(List.of(
                call(1, 200, 100), call(2, 200, 200), call(7, 500, 300), call(59, 200, 1000)), START, END, BUCKET);

        assertThat(summary.currentResponseTime()).isEqualTo(1000.0);
        assertThat(summary.currentErrorRate()).isZero();
        assertThat(summary.responseTimeSeries()).containsExactly(150.0, 300.0);
        assertThat(summary.errorRateSeries()).containsExactly(0.0, 1.0);
    }

    @Test
    @DisplayName("should count client errors as successes")
    void shouldIgnoreClientErrors() {
        ApiMetricsSummary summary = ApiMetricsSummary.from(List.of(call(1, 404, 10)), START, END, BUCKET);

        assertThat(summary.errorRate()).isZero();
        assertThat(summary.statusDistribution()).containsEntry("4xx", 1L);
    }

    @Test
    @DisplayName("should pick the nearest-rank percentile")
    void shouldUseNearestRank() {
        long[] sorted = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        assertThat(ApiMetricsSummary.nearestRank(sorted, 50)).isEqualTo(5.0);
        assertThat(ApiMetricsSummary.nearestRank(sorted, 95)).isEqualTo(10.0);
        assertThat(ApiMetricsSummary.nearestRank(new long[0], 95)).isZero();
    }
}
