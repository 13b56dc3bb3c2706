package com.warden.engine.domain.metrics;

import java.util.Locale;

/**
 * Resources with usage thresholds and forecasts.
 */
public enum Resource {
    CPU,
    MEMORY,
    DISK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
