package com.warden.engine.domain.metrics;

/**
 * Current value of one metric with its window and day averages.
 *
 * @param trend percentage change of {@code current} against {@code windowAverage}, see {@link TrendCalculator}
 */
public record ResourceMetric(double current, double windowAverage, double dayAverage, double trend) {

    static ResourceMetric of(double current, double windowAverage, double dayAverage) {
        return new ResourceMetric(current, windowAverage, dayAverage, TrendCalculator.trend(current, windowAverage));
    }
}
