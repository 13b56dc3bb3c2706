package com.warden.engine.config;

import com.warden.engine.domain.queue.QueueClass;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Remediation catalog tuning, bound from {@code warden.remediation.*}.
 *
 * <pre>
 * warden:
 *   remediation:
 *     memory-hard-pct: 85
 *     stuck-short: 5m
 *     stuck-long: 1h
 *     log-dir: /var/log/app
 *     log-retention: 7d
 * </pre>
 *
 * @param memoryHardPct memory usage above which the shared cache is cleared (default 85).
 * @param workerMemoryCeilingMb per-worker memory above which the worker is restarted (default 512).
 * @param stuckShort active time after which a job in a {@link QueueClass#SHORT} queue is stuck (default 5m).
 * @param stuckLong active time after which a job in a {@link QueueClass#LONG} queue is stuck (default 1h).
 * @param completedRetention completed jobs older than this are purged (default 24h).
 * @param tempDir directory holding process temporary files (default java.io.tmpdir/warden).
 * @param tempMaxAge temporary files older than this are removed under memory pressure (default 1h).
 * @param logDir directory holding rotated logs (default logs).
 * @param logRetention logs older than this are removed (default 7d).
 * @param uploadTempDir directory holding in-flight upload files (default uploads/tmp).
 * @param uploadTempMaxAge orphaned upload files older than this are removed (default 24h).
 * @param chunkDir directory holding partial upload chunks (default uploads/chunks).
 * @param chunkMaxAge failed chunks older than this are removed (default 24h).
 * @param compressEnabled whether old files are gzip-compressed (default false).
 * @param compressDir directory whose old files are compressed (default uploads/archive).
 * @param compressAfter files older than this are compressed (default 30d).
 */
@ConfigurationProperties(prefix = "warden.remediation")
@Validated
public record RemediationProperties(
        double memoryHardPct,
        long workerMemoryCeilingMb,
        Duration stuckShort,
        Duration stuckLong,
        Duration completedRetention,
        String tempDir,
        Duration tempMaxAge,
        String logDir,
        Duration logRetention,
        String uploadTempDir,
        Duration uploadTempMaxAge,
        String chunkDir,
        Duration chunkMaxAge,
        boolean compressEnabled,
        String compressDir,
        Duration compressAfter) {

    public RemediationProperties {
        if (memoryHardPct <= 0) {
            memoryHardPct = 85;
        }
        if (workerMemoryCeilingMb <= 0) {
            workerMemoryCeilingMb = 512;
        }
        stuckShort = orDefault(stuckShort, Duration.ofMinutes(5));
        stuckLong = orDefault(stuckLong, Duration.ofHours(1));
        completedRetention = orDefault(completedRetention, Duration.ofHours(24));
        tempDir = orDefault(tempDir, System.getProperty("java.io.tmpdir") + "/warden");
        tempMaxAge = orDefault(tempMaxAge, Duration.ofHours(1));
        logDir = orDefault(logDir, "logs");
        logRetention = orDefault(logRetention, Duration.ofDays(7));
        uploadTempDir = orDefault(uploadTempDir, "uploads/tmp");
        uploadTempMaxAge = orDefault(uploadTempMaxAge, Duration.ofHours(24));
        chunkDir = orDefault(chunkDir, "uploads/chunks");
        chunkMaxAge = orDefault(chunkMaxAge, Duration.ofHours(24));
        compressDir = orDefault(compressDir, "uploads/archive");
        compressAfter = orDefault(compressAfter, Duration.ofDays(30));
    }

    /** Staleness threshold for jobs of the given queue class. */
    public Duration stuckThreshold(QueueClass queueClass) {
        return queueClass == QueueClass.LONG ? stuckLong : stuckShort;
    }

    /** Defaults for every setting. */
    public static RemediationProperties defaults() {
        return new RemediationProperties(
                0, 0, null, null, null, null, null, null, null, null, null, null, null, false, null,
                null);
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
