package com.warden.engine.domain.health;

import com.warden.observability.HealthStatus;

/**
 * Soft/hard threshold pair: at or below soft is healthy, above soft is degraded, above hard is
 * unhealthy.
 */
public record ThresholdBands(double soft, double hard) {

    public ThresholdBands {
        if (soft > hard) {
            throw new IllegalArgumentException("soft threshold " + soft + " exceeds hard threshold " + hard);
        }
    }

    public HealthStatus classify(double value) {
        if (value > hard) {
            return HealthStatus.UNHEALTHY;
        }
        if (value > soft) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }
}
