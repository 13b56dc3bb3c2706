package com.warden.engine.domain.alert;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted system alert.
 *
 * @param source subsystem that raised the alert
 * @param component health component or queue the alert concerns, may be null
 * @param resolvedBy operator who resolved the alert, null until resolved
 */
public record Alert(
        String id,
        AlertSeverity severity,
        AlertCategory category,
        String title,
        String message,
        Map<String, Object> details,
        String source,
        AlertStatus status,
        String component,
        Instant timestamp,
        String resolvedBy,
        String resolutionMessage,
        Instant resolvedAt) {

    public Alert {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }

    /** Copy of this alert in the {@link AlertStatus#RESOLVED} state. */
    public Alert resolve(String by, String resolution, Instant at) {
        return new Alert(id, severity, category, title, message, details, source, AlertStatus.RESOLVED,
                component, timestamp, by, resolution, at);
    }
}
