package com.warden.engine.domain.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * API latency and error view over a window.
 *
 * <p>The window is cut into fixed-width buckets. {@code currentResponseTime} and {@code
 * currentErrorRate} come from the most recent non-empty bucket; the series hold the earlier
 * non-empty buckets, oldest first, and serve as the baseline for anomaly detection.
 *
 * @param totalRequests calls in the window
 * @param averageResponseTimeMs mean latency over the window
 * @param p95ResponseTimeMs nearest-rank 95th percentile latency
 * @param p99ResponseTimeMs nearest-rank 99th percentile latency
 * @param errorRate share of calls with a 5xx status
 * @param statusDistribution call counts keyed by status class ({@code 2xx}, {@code 5xx}, ...)
 */
public record ApiMetricsSummary(
        long totalRequests,
        double averageResponseTimeMs,
        double p95ResponseTimeMs,
        double p99ResponseTimeMs,
        double errorRate,
        double currentResponseTime,
        double currentErrorRate,
        List<Double> responseTimeSeries,
        List<Double> errorRateSeries,
        Map<String, Long> statusDistribution) {

    public ApiMetricsSummary {
        responseTimeSeries = List.copyOf(responseTimeSeries);
        errorRateSeries = List.copyOf(errorRateSeries);
        statusDistribution = Map.copyOf(statusDistribution);
    }

    /**
     * Builds the summary of {@code calls} recorded in {@code [windowStart, windowEnd]}.
     */
    public static ApiMetricsSummary from(List<ApiCall> calls, Instant windowStart, Instant windowEnd,
                                         Duration bucket) {
        if (calls.isEmpty()) {
            return new ApiMetricsSummary(0, 0, 0, 0, 0, 0, 0, List.of(), List.of(), Map.of());
        }

        long[] latencies = new long[calls.size()];
        long totalLatency = 0;
        long errors = 0;
        Map<String, Long> distribution = new TreeMap<>();
        int bucketCount = (int) Math.max(1,
                (Duration.between(windowStart, windowEnd).toMillis() + bucket.toMillis() - 1) / bucket.toMillis());
        long[] bucketCalls = new long[bucketCount];
        long[] bucketLatency = new long[bucketCount];
        long[] bucketErrors = new long[bucketCount];

        for (int i = 0; i < calls.size(); i++) {
            ApiCall call = calls.get(i);
            latencies[i] = call.responseTimeMs();
            totalLatency += call.responseTimeMs();
            if (call.isError()) {
                errors++;
            }
            distribution.merge((call.statusCode() / 100) + "xx", 1L, Long::sum);

            long offset = Duration.between(windowStart, call.timestamp()).toMillis();
            int index = (int) Math.min(bucketCount - 1, Math.max(0, offset / bucket.toMillis()));
            bucketCalls[index]++;
            bucketLatency[index] += call.responseTimeMs();
            if (call.isError()) {
                bucketErrors[index]++;
            }
        }

        List<Double> responseSeries = new ArrayList<>();
        List<Double> errorSeries = new ArrayList<>();
        for (int i = 0; i < bucketCount; i++) {
            if (bucketCalls[i] > 0) {
                responseSeries.add((double) bucketLatency[i] / bucketCalls[i]);
                errorSeries.add((double) bucketErrors[i] / bucketCalls[i]);
            }
        }
        double currentResponse = responseSeries.remove(responseSeries.size() - 1);
        double currentError = errorSeries.remove(errorSeries.size() - 1);

        Arrays.sort(latencies);
        return new ApiMetricsSummary(
                calls.size(),
                (double) totalLatency / calls.size(),
                nearestRank(latencies, 95),
                nearestRank(latencies, 99),
                (double) errors / calls.size(),
                currentResponse,
                currentError,
                responseSeries,
                errorSeries,
                distribution);
    }

    /** Nearest-rank percentile of an ascending array; 0 for an empty array. */
    static double nearestRank(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length, rank) - 1)];
    }
}
