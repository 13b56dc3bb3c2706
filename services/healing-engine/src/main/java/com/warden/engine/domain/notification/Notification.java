package com.warden.engine.domain.notification;

import com.warden.engine.domain.alert.AlertSeverity;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrator notification with a structured payload.
 */
public record Notification(String subject, AlertSeverity severity, Map<String, Object> payload, Instant createdAt) {

    public Notification {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
