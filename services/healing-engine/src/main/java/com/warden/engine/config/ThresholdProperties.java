package com.warden.engine.config;

import com.warden.engine.domain.metrics.Resource;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Early-warning thresholds checked by the fast monitoring cadence. Loaded once at startup.
 *
 * <pre>
 * warden:
 *   thresholds:
 *     cpu-usage: 80
 *     memory-usage: 85
 *     disk-usage: 85
 *     queue-length: 1000
 *     error-rate: 0.05
 * </pre>
 *
 * @param cpuUsage CPU usage percentage above which the CPU handler fires.
 * @param memoryUsage memory usage percentage above which the memory handler fires.
 * @param diskUsage disk usage percentage above which the disk handler fires.
 * @param queueLength waiting jobs per queue above which the backlog handler fires.
 * @param errorRate per-queue failed/(completed+failed) ratio above which the error-rate handler fires.
 */
@ConfigurationProperties(prefix = "warden.thresholds")
@Validated
public record ThresholdProperties(
        @Positive @DecimalMax("100") double cpuUsage,
        @Positive @DecimalMax("100") double memoryUsage,
        @Positive @DecimalMax("100") double diskUsage,
        @Positive int queueLength,
        @Positive @DecimalMax("1") double errorRate) {

    public ThresholdProperties {
        if (cpuUsage <= 0) {
            cpuUsage = 80;
        }
        if (memoryUsage <= 0) {
            memoryUsage = 85;
        }
        if (diskUsage <= 0) {
            diskUsage = 85;
        }
        if (queueLength <= 0) {
            queueLength = 1000;
        }
        if (errorRate <= 0) {
            errorRate = 0.05;
        }
    }

    /** Defaults for every threshold. */
    public static ThresholdProperties defaults() {
        return new ThresholdProperties(0, 0, 0, 0, 0);
    }

    /** Usage percentage above which {@code resource} is considered under pressure. */
    public double usageThreshold(Resource resource) {
        switch (resource) {
            case CPU:
                return cpuUsage;
            case MEMORY:
                return memoryUsage;
            case DISK:
                return diskUsage;
            default:
                throw new IllegalArgumentException("Unsupported resource: " + resource);
        }
    }
}
