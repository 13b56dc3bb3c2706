package com.warden.engine.domain.health;

import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthStatus;
import com.warden.observability.TimedHealthCheck;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.DoubleSupplier;

/**
 * Classifies a usage percentage (process memory, disk) against soft and hard bands.
 */
public class ResourceHealthCheck extends TimedHealthCheck {

    private final DoubleSupplier usagePct;
    private final ThresholdBands bands;

    public ResourceHealthCheck(String name, DoubleSupplier usagePct, ThresholdBands bands, Executor executor) {
        super(name, executor);
        this.usagePct = usagePct;
        this.bands = bands;
    }

    @Override
    protected ComponentHealth probe(long startNanos) {
        double usage = usagePct.getAsDouble();
        HealthStatus status = bands.classify(usage);
        Map<String, Object> detail =
                Map.of("usagePct", round(usage), "softPct", bands.soft(), "hardPct", bands.hard());
        long elapsed = elapsedMs(startNanos);
        switch (status) {
            case UNHEALTHY:
                return ComponentHealth.unhealthy(name(),
                        String.format(Locale.ROOT, "Usage %.1f%% exceeds %.1f%%", usage, bands.hard()), elapsed, detail);
            case DEGRADED:
                return ComponentHealth.degraded(name(),
                        String.format(Locale.ROOT, "Usage %.1f%% exceeds %.1f%%", usage, bands.soft()), elapsed, detail);
            default:
                return ComponentHealth.healthy(name(), elapsed, detail);
        }
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
