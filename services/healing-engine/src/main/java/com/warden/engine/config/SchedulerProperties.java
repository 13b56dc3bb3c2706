package com.warden.engine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Monitoring cadences, bound from {@code warden.scheduler.*}.
 *
 * @param enabled whether the lanes are registered at startup (default true).
 * @param fastInterval fixed rate of the fast lane (default 1m).
 * @param mediumInterval fixed rate of the medium lane (default 10m).
 * @param dailyCron cron expression of the daily report lane (default 06:00 every day).
 * @param initialDelay delay before the first fast and medium runs (default 30s).
 * @param poolSize scheduler threads; one per lane keeps lanes independent (default 3).
 */
@ConfigurationProperties(prefix = "warden.scheduler")
@Validated
public record SchedulerProperties(
        Boolean enabled,
        Duration fastInterval,
        Duration mediumInterval,
        String dailyCron,
        Duration initialDelay,
        int poolSize) {

    public SchedulerProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (fastInterval == null || fastInterval.isZero() || fastInterval.isNegative()) {
            fastInterval = Duration.ofMinutes(1);
        }
        if (mediumInterval == null || mediumInterval.isZero() || mediumInterval.isNegative()) {
            mediumInterval = Duration.ofMinutes(10);
        }
        if (dailyCron == null || dailyCron.isBlank()) {
            dailyCron = "0 0 6 * * *";
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            initialDelay = Duration.ofSeconds(30);
        }
        if (poolSize <= 0) {
            poolSize = 3;
        }
    }
}
