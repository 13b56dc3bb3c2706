package com.warden.engine.domain.metrics;

/**
 * Takes a fresh {@link MetricsSnapshot} of the host and process.
 */
@FunctionalInterface
public interface MetricsSampler {

    MetricsSnapshot sample();
}
