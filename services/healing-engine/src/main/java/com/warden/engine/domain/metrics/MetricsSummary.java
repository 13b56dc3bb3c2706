package com.warden.engine.domain.metrics;

import java.time.Instant;

/**
 * Rolling summary of system and API metrics for one window.
 *
 * @param window window label ({@code 1m}, {@code hour}, {@code day}, {@code week}, {@code month})
 * @param latestSnapshotAt timestamp of the snapshot the current values come from
 */
public record MetricsSummary(
        Instant timestamp,
        String window,
        Instant latestSnapshotAt,
        ResourceMetric cpu,
        ResourceMetric memory,
        ResourceMetric disk,
        ResourceMetric networkIn,
        ResourceMetric networkOut,
        ResourceMetric connections,
        MetricsSnapshot.LoadAverage loadAverage,
        ApiMetricsSummary api) {

    /** The metric for one resource. */
    public ResourceMetric of(Resource resource) {
        switch (resource) {
            case CPU:
                return cpu;
            case MEMORY:
                return memory;
            case DISK:
                return disk;
            default:
                throw new IllegalArgumentException("Unsupported resource: " + resource);
        }
    }
}
