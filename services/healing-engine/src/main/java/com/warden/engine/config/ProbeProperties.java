package com.warden.engine.config;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Health probe tuning, bound from {@code warden.probes.*}.
 *
 * @param timeoutMs per-probe timeout; a probe that exceeds it is reported unhealthy (default 5000).
 * @param memorySoftPct heap usage above which memory is degraded (default 75).
 * @param memoryHardPct heap usage above which memory is unhealthy (default 90).
 * @param diskSoftPct disk usage above which disk is degraded (default 75).
 * @param diskHardPct disk usage above which disk is unhealthy (default 90).
 * @param queueFailureRate per-queue error rate above which a queue is unhealthy (default 0.1).
 * @param queueDelayed per-queue delayed jobs above which a queue is unhealthy (default 100).
 * @param degradedFactor fraction of a queue threshold above which a queue is degraded (default 0.5).
 * @param historyCapacity number of health reports kept in the history log (default 1000).
 * @param diskPath path whose file store is probed for disk usage (default "/").
 * @param poolSize threads available to run probes concurrently (default 6).
 */
@ConfigurationProperties(prefix = "warden.probes")
@Validated
public record ProbeProperties(
        long timeoutMs,
        double memorySoftPct,
        double memoryHardPct,
        double diskSoftPct,
        double diskHardPct,
        double queueFailureRate,
        int queueDelayed,
        double degradedFactor,
        int historyCapacity,
        String diskPath,
        int poolSize) {

    public ProbeProperties {
        if (timeoutMs <= 0) {
            timeoutMs = 5000;
        }
        if (memorySoftPct <= 0) {
            memorySoftPct = 75;
        }
        if (memoryHardPct <= 0) {
            memoryHardPct = 90;
        }
        if (diskSoftPct <= 0) {
            diskSoftPct = 75;
        }
        if (diskHardPct <= 0) {
            diskHardPct = 90;
        }
        if (queueFailureRate <= 0) {
            queueFailureRate = 0.1;
        }
        if (queueDelayed <= 0) {
            queueDelayed = 100;
        }
        if (degradedFactor <= 0 || degradedFactor >= 1) {
            degradedFactor = 0.5;
        }
        if (historyCapacity <= 0) {
            historyCapacity = 1000;
        }
        if (diskPath == null || diskPath.isBlank()) {
            diskPath = "/";
        }
        if (poolSize <= 0) {
            poolSize = 6;
        }
    }

    @AssertTrue(message = "soft thresholds must not exceed hard thresholds")
    public boolean isBandOrderValid() {
        return memorySoftPct <= memoryHardPct && diskSoftPct <= diskHardPct;
    }

    /** Defaults for every setting. */
    public static ProbeProperties defaults() {
        return new ProbeProperties(0, 0, 0, 0, 0, 0, 0, 0, 0, null, 0);
    }
}
