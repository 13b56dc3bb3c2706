package com.warden.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate health result from all registered health checks.
 * <p>
 * The aggregate {@code status} is always the maximum severity over {@code components}.
 * Use {@link #of(Map, Instant)} to derive it; the canonical constructor rejects an
 * inconsistent status.
 *
 * @param status     overall system health
 * @param components individual component results keyed by component name, in probe order
 * @param timestamp  when the health check was performed
 */
public record HealthReport(
        HealthStatus status,
        Map<String, ComponentHealth> components,
        Instant timestamp
) {

    public HealthReport {
        if (status == null || components == null || timestamp == null) {
            throw new IllegalArgumentException("status, components and timestamp must not be null");
        }
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        HealthStatus derived = HealthStatus.worstOf(
                components.values().stream().map(ComponentHealth::status).toList());
        if (derived != status) {
            throw new IllegalArgumentException(
                    "status " + status + " does not match component severity " + derived);
        }
    }

    /**
     * Builds a report whose status is derived from the component results.
     */
    public static HealthReport of(Map<String, ComponentHealth> components, Instant timestamp) {
        HealthStatus status = HealthStatus.worstOf(
                components.values().stream().map(ComponentHealth::status).toList());
        return new HealthReport(status, components, timestamp);
    }

    /**
     * Returns the result for one component, if it was probed.
     */
    public Optional<ComponentHealth> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    /**
     * Returns true if the named component was probed and is not healthy.
     */
    public boolean needsAttention(String name) {
        return component(name).map(ComponentHealth::needsAttention).orElse(false);
    }
}
