package com.warden.engine.domain.anomaly;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential moving average forecast of a usage series.
 */
public class ResourceForecaster {

    private static final Logger log = LoggerFactory.getLogger(ResourceForecaster.class);

    private final double alpha;

    public ResourceForecaster(double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1]");
        }
        this.alpha = alpha;
    }

    /**
     * Forecasts the next value of {@code series} (oldest first). Falls back to the largest finite
     * value of the series when the EMA cannot be computed; an empty series forecasts 0.
     */
    public double forecast(List<Double> series) {
        if (series.isEmpty()) {
            return 0;
        }
        try {
            return ema(series);
        } catch (ArithmeticException e) {
            double fallback = series.stream()
                    .filter(Double::isFinite)
                    .mapToDouble(Double::doubleValue)
                    .max()
                    .orElse(0);
            log.warn("Forecast failed ({}), using historical maximum {}", e.getMessage(), fallback);
            return fallback;
        }
    }

    double ema(List<Double> series) {
        double value = series.get(0);
        for (int i = 1; i < series.size(); i++) {
            value = alpha * series.get(i) + (1 - alpha) * value;
        }
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("non-finite forecast");
        }
        return value;
    }

    public double alpha() {
        return alpha;
    }
}
