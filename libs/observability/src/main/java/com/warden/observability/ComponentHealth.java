package com.warden.observability;

import java.util.Map;

/**
 * Health result for a single component, created fresh each probe cycle.
 *
 * @param name           component name (e.g., "database", "cache", "queues")
 * @param status         health status of this component
 * @param responseTimeMs wall-clock time taken by the probe (in milliseconds)
 * @param error          optional error message when the probe failed or classified a problem
 * @param detail         probe-specific detail (e.g., usage percentage, per-queue counts)
 */
public record ComponentHealth(
        String name,
        HealthStatus status,
        long responseTimeMs,
        String error,
        Map<String, Object> detail
) {

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, long responseTimeMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, responseTimeMs, null, Map.of());
    }

    /** Creates a healthy component result carrying probe detail. */
    public static ComponentHealth healthy(String name, long responseTimeMs, Map<String, Object> detail) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, responseTimeMs, null, detail);
    }

    /** Creates a degraded component result. */
    public static ComponentHealth degraded(String name, String error, long responseTimeMs,
                                           Map<String, Object> detail) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, responseTimeMs, error, detail);
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(String name, String error, long responseTimeMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, responseTimeMs, error, Map.of());
    }

    /** Creates an unhealthy component result carrying probe detail. */
    public static ComponentHealth unhealthy(String name, String error, long responseTimeMs,
                                            Map<String, Object> detail) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, responseTimeMs, error, detail);
    }

    /**
     * Returns true unless the component is {@link HealthStatus#HEALTHY}.
     */
    public boolean needsAttention() {
        return status != HealthStatus.HEALTHY;
    }
}
