package com.warden.engine.domain.metrics;

import java.time.Duration;
import java.util.Locale;

/**
 * Look-back windows for performance summaries, with the bucket width used for their series.
 */
public enum PerformanceWindow {
    MINUTE("1m", Duration.ofMinutes(1), Duration.ofSeconds(10)),
    HOUR("hour", Duration.ofHours(1), Duration.ofMinutes(5)),
    DAY("day", Duration.ofDays(1), Duration.ofHours(1)),
    WEEK("week", Duration.ofDays(7), Duration.ofHours(6)),
    MONTH("month", Duration.ofDays(30), Duration.ofDays(1));

    private final String label;
    private final Duration length;
    private final Duration bucket;

    PerformanceWindow(String label, Duration length, Duration bucket) {
        this.label = label;
        this.length = length;
        this.bucket = bucket;
    }

    public String label() {
        return label;
    }

    public Duration length() {
        return length;
    }

    public Duration bucket() {
        return bucket;
    }

    /** Parses a window label; null, blank and unknown labels fall back to {@link #HOUR}. */
    public static PerformanceWindow parse(String label) {
        if (label == null || label.isBlank()) {
            return HOUR;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (PerformanceWindow window : values()) {
            if (window.label.equals(normalized)) {
                return window;
            }
        }
        return HOUR;
    }
}
