package com.warden.engine.domain.metrics;

import java.time.Instant;

/**
 * Point-in-time host and process resource sample. Append-only; never updated.
 *
 * @param timestamp when the sample was taken
 * @param cpuUsagePct system CPU usage percentage
 * @param memoryUsagePct process memory usage percentage
 * @param diskUsagePct usage of the monitored file store
 * @param networkBytesIn cumulative bytes received on all interfaces
 * @param networkBytesOut cumulative bytes sent on all interfaces
 * @param connectionCount open TCP connections
 * @param loadAverage 1, 5 and 15 minute load averages
 */
public record MetricsSnapshot(
        Instant timestamp,
        double cpuUsagePct,
        double memoryUsagePct,
        double diskUsagePct,
        long networkBytesIn,
        long networkBytesOut,
        int connectionCount,
        LoadAverage loadAverage) {

    public MetricsSnapshot {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (loadAverage == null) {
            loadAverage = LoadAverage.UNAVAILABLE;
        }
    }

    /** Value of one resource in this snapshot. */
    public double usageOf(Resource resource) {
        switch (resource) {
            case CPU:
                return cpuUsagePct;
            case MEMORY:
                return memoryUsagePct;
            case DISK:
                return diskUsagePct;
            default:
                throw new IllegalArgumentException("Unsupported resource: " + resource);
        }
    }

    /**
     * System load averages.
     */
    public record LoadAverage(double oneMinute, double fiveMinutes, double fifteenMinutes) {

        public static final LoadAverage UNAVAILABLE = new LoadAverage(0, 0, 0);
    }
}
