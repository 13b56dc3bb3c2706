package com.warden.engine.domain.notification;

import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthReport;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens domain records into notification payload maps.
 */
public final class ReportPayloads {

    private ReportPayloads() {
    }

    /** Status, timestamp and per-component status/error of {@code report}. */
    public static Map<String, Object> healthReport(HealthReport report) {
        Map<String, Object> components = new LinkedHashMap<>();
        for (ComponentHealth component : report.components().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", component.status().wireName());
            entry.put("responseTimeMs", component.responseTimeMs());
            if (component.error() != null) {
                entry.put("error", component.error());
            }
            if (!component.detail().isEmpty()) {
                entry.put("detail", component.detail());
            }
            components.put(component.name(), entry);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", report.status().wireName());
        payload.put("timestamp", report.timestamp().toString());
        payload.put("components", components);
        return payload;
    }
}
