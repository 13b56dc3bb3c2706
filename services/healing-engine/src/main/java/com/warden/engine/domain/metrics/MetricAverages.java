package com.warden.engine.domain.metrics;

/**
 * Mean of each snapshot field over a window.
 *
 * @param samples number of snapshots averaged
 */
public record MetricAverages(
        double cpuUsagePct,
        double memoryUsagePct,
        double diskUsagePct,
        double networkBytesIn,
        double networkBytesOut,
        double connectionCount,
        long samples) {
}
