package com.warden.observability;

import java.util.Collection;
import java.util.Locale;

/**
 * Health status for an individual component or the aggregate system.
 * <p>
 * Constants are declared in ascending severity. {@link #worstOf(Collection)} relies on
 * that ordering to reduce a set of component statuses into the aggregate status.
 */
public enum HealthStatus {

    /** The component is functioning normally. */
    HEALTHY,

    /** The component is impaired but still serving. */
    DEGRADED,

    /** The component is down or its probe failed. */
    UNHEALTHY;

    /**
     * Returns the more severe of this status and {@code other}.
     */
    public HealthStatus worse(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    /**
     * Returns true if this status is strictly more severe than {@code other}.
     */
    public boolean isWorseThan(HealthStatus other) {
        return ordinal() > other.ordinal();
    }

    /**
     * Reduces statuses to the most severe one. An empty collection is {@link #HEALTHY}.
     *
     * @param statuses component statuses, no null elements
     * @return the maximum severity over {@code statuses}
     */
    public static HealthStatus worstOf(Collection<HealthStatus> statuses) {
        HealthStatus worst = HEALTHY;
        for (HealthStatus status : statuses) {
            worst = worst.worse(status);
        }
        return worst;
    }

    /**
     * Lower-case wire name (e.g. {@code "degraded"}).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
