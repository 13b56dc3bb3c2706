package com.warden.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Anomaly detection, forecasting and pattern analysis policy, bound from {@code warden.detection.*}.
 *
 * @param sigmaThreshold number of population standard deviations that makes a value anomalous (default 2.0).
 * @param forecastAlpha EMA smoothing factor for resource forecasts (default 0.2).
 * @param backlogMinSamples backlog samples required before a backlog can be called systematic (default 3).
 * @param backlogSystematicFraction fraction of samples that must exceed the queue-length threshold (default 0.8).
 * @param backlogHistorySize backlog samples retained per queue (default 10).
 * @param backlogPerWorker waiting jobs one additional worker is expected to absorb (default 500).
 * @param maxWorkers upper bound for recommended workers per queue (default 10).
 * @param errorPatternSignificance share of recent errors one message must account for (default 0.7).
 * @param errorPatternMinErrors minimum recent errors before patterns are evaluated (default 10).
 * @param errorPatternWindowMinutes look-back window for error pattern analysis (default 5).
 */
@ConfigurationProperties(prefix = "warden.detection")
@Validated
public record DetectionProperties(
        double sigmaThreshold,
        double forecastAlpha,
        int backlogMinSamples,
        double backlogSystematicFraction,
        int backlogHistorySize,
        int backlogPerWorker,
        int maxWorkers,
        double errorPatternSignificance,
        int errorPatternMinErrors,
        int errorPatternWindowMinutes) {

    public DetectionProperties {
        if (sigmaThreshold <= 0) {
            sigmaThreshold = 2.0;
        }
        if (forecastAlpha <= 0 || forecastAlpha > 1) {
            forecastAlpha = 0.2;
        }
        if (backlogMinSamples <= 0) {
            backlogMinSamples = 3;
        }
        if (backlogSystematicFraction <= 0 || backlogSystematicFraction > 1) {
            backlogSystematicFraction = 0.8;
        }
        if (backlogHistorySize < backlogMinSamples) {
            backlogHistorySize = Math.max(10, backlogMinSamples);
        }
        if (backlogPerWorker <= 0) {
            backlogPerWorker = 500;
        }
        if (maxWorkers <= 0) {
            maxWorkers = 10;
        }
        if (errorPatternSignificance <= 0 || errorPatternSignificance > 1) {
            errorPatternSignificance = 0.7;
        }
        if (errorPatternMinErrors <= 0) {
            errorPatternMinErrors = 10;
        }
        if (errorPatternWindowMinutes <= 0) {
            errorPatternWindowMinutes = 5;
        }
    }

    /** Defaults for every setting. */
    public static DetectionProperties defaults() {
        return new DetectionProperties(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
