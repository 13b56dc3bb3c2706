package com.warden.engine.domain.metrics;

import com.warden.engine.domain.queue.JobQueue;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.domain.queue.QueueMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.ToDoubleFunction;

/**
 * Read-side view over the metrics stores and queue backends.
 *
 * <p>Queue backends are sampled in parallel and each sample is bounded by the sampling timeout.
 * A queue whose previous sample is still running is not sampled again; callers wait on the
 * running one instead, so a hung backend holds at most one executor thread.
 */
public class MetricsAggregator {

    static final String METRICS_UNAVAILABLE = "System metrics data not available";
    static final Duration DEFAULT_ERROR_RANGE = Duration.ofDays(1);

    private final MetricsStore metricsStore;
    private final ApiMetricsStore apiMetricsStore;
    private final ErrorLogStore errorLogStore;
    private final JobQueues queues;
    private final Executor executor;
    private final Duration samplingTimeout;
    private final Clock clock;
    private final ConcurrentMap<String, CompletableFuture<QueueMetrics>> samplesInFlight = new ConcurrentHashMap<>();

    public MetricsAggregator(MetricsStore metricsStore, ApiMetricsStore apiMetricsStore, ErrorLogStore errorLogStore,
                             JobQueues queues, Executor executor, Duration samplingTimeout, Clock clock) {
        if (samplingTimeout.isNegative() || samplingTimeout.isZero()) {
            throw new IllegalArgumentException("samplingTimeout must be positive");
        }
        this.metricsStore = metricsStore;
        this.apiMetricsStore = apiMetricsStore;
        this.errorLogStore = errorLogStore;
        this.queues = queues;
        this.executor = executor;
        this.samplingTimeout = samplingTimeout;
        this.clock = clock;
    }

    /**
     * Summary over the last hour.
     *
     * @throws MetricsUnavailableException if no snapshot has been written yet
     */
    public MetricsSummary getMetricsSummary() {
        return getPerformanceMetrics(PerformanceWindow.HOUR);
    }

    /**
     * Summary over {@code window}: latest values, window and day averages, trends and the API view.
     *
     * @throws MetricsUnavailableException if no snapshot has been written yet
     */
    public MetricsSummary getPerformanceMetrics(PerformanceWindow window) {
        Instant now = clock.instant();
        MetricsSnapshot latest = metricsStore.latest()
                .orElseThrow(() -> new MetricsUnavailableException(METRICS_UNAVAILABLE));

        Instant windowStart = now.minus(window.length());
        MetricAverages windowAvg = metricsStore.averageSince(windowStart).orElse(null);
        MetricAverages dayAvg = metricsStore.averageSince(now.minus(Duration.ofDays(1))).orElse(null);

        ApiMetricsSummary api = ApiMetricsSummary.from(
                apiMetricsStore.since(windowStart), windowStart, now, window.bucket());

        return new MetricsSummary(
                now,
                window.label(),
                latest.timestamp(),
                ResourceMetric.of(latest.cpuUsagePct(),
                        avg(windowAvg, MetricAverages::cpuUsagePct), avg(dayAvg, MetricAverages::cpuUsagePct)),
                ResourceMetric.of(latest.memoryUsagePct(),
                        avg(windowAvg, MetricAverages::memoryUsagePct), avg(dayAvg, MetricAverages::memoryUsagePct)),
                ResourceMetric.of(latest.diskUsagePct(),
                        avg(windowAvg, MetricAverages::diskUsagePct), avg(dayAvg, MetricAverages::diskUsagePct)),
                ResourceMetric.of(latest.networkBytesIn(),
                        avg(windowAvg, MetricAverages::networkBytesIn), avg(dayAvg, MetricAverages::networkBytesIn)),
                ResourceMetric.of(latest.networkBytesOut(),
                        avg(windowAvg, MetricAverages::networkBytesOut), avg(dayAvg, MetricAverages::networkBytesOut)),
                ResourceMetric.of(latest.connectionCount(),
                        avg(windowAvg, MetricAverages::connectionCount), avg(dayAvg, MetricAverages::connectionCount)),
                latest.loadAverage(),
                api);
    }

    /**
     * Raw counts of every queue, sampled in parallel. No thresholds are applied.
     *
     * @throws MetricsUnavailableException if any queue backend cannot be read within the sampling timeout
     */
    public Map<String, QueueMetrics> getQueueMetrics() {
        Map<String, CompletableFuture<QueueMetrics>> samples = new LinkedHashMap<>();
        for (JobQueue queue : queues.all()) {
            samples.put(queue.name(), sample(queue).orTimeout(samplingTimeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        Map<String, QueueMetrics> result = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<QueueMetrics>> entry : samples.entrySet()) {
            try {
                result.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                throw unavailable(entry.getKey(), e.getCause() != null ? e.getCause() : e);
            }
        }
        return result;
    }

    /**
     * Error log view between {@code from} and {@code to}. A missing {@code to} means now and a
     * missing {@code from} means one day before {@code to}.
     *
     * @param component only errors of this component; {@code null} or blank for all of them
     * @throws IllegalArgumentException if {@code from} is after {@code to}
     */
    public ErrorMetrics getErrorMetrics(String component, Instant from, Instant to) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_ERROR_RANGE);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        String filter = component == null || component.isBlank() ? null : component.trim();
        return ErrorMetrics.of(filter, start, end, errorLogStore.between(filter, start, end));
    }

    /** Usage series of {@code resource} over the last {@code lookback}, oldest first. */
    public List<Double> usageSeries(Resource resource, Duration lookback) {
        return metricsStore.since(clock.instant().minus(lookback)).stream()
                .map(snapshot -> snapshot.usageOf(resource))
                .toList();
    }

    private CompletableFuture<QueueMetrics> sample(JobQueue queue) {
        return samplesInFlight.compute(queue.name(), (name, running) ->
                running != null && !running.isDone() ? running : startSample(queue)).copy();
    }

    private CompletableFuture<QueueMetrics> startSample(JobQueue queue) {
        try {
            return CompletableFuture.supplyAsync(() -> QueueMetrics.sample(queue), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private MetricsUnavailableException unavailable(String queue, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new MetricsUnavailableException("Queue metrics unavailable for " + queue
                    + ": timed out after " + samplingTimeout.toMillis() + " ms");
        }
        return new MetricsUnavailableException("Queue metrics unavailable for " + queue + ": " + cause.getMessage());
    }

    private static double avg(MetricAverages averages, ToDoubleFunction<MetricAverages> field) {
        return averages == null ? 0 : field.applyAsDouble(averages);
    }
}
