package com.warden.engine.domain.anomaly;

import java.time.Instant;
import java.util.List;

/**
 * A value that deviates from its historical series by more than the sigma threshold.
 */
public record Anomaly(String metricType, double currentValue, List<Double> historicalSeries, Instant detectedAt) {

    public Anomaly {
        historicalSeries = List.copyOf(historicalSeries);
    }
}
