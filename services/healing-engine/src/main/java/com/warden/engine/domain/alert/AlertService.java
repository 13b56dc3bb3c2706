package com.warden.engine.domain.alert;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raises, lists and resolves system alerts.
 */
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertStore store;
    private final String source;
    private final Clock clock;

    /**
     * @param source recorded as the {@link Alert#source()} of every raised alert
     */
    public AlertService(AlertStore store, String source, Clock clock) {
        this.store = store;
        this.source = source;
        this.clock = clock;
    }

    /**
     * Stores a new active alert.
     *
     * @param component health component or queue concerned, may be null
     */
    public Alert raise(
            AlertSeverity severity,
            AlertCategory category,
            String component,
            String title,
            String message,
            Map<String, Object> details) {
        Alert alert = new Alert(
                UUID.randomUUID().toString(), severity, category, title, message, details, source,
                AlertStatus.ACTIVE, component, clock.instant(), null, null, null);
        store.save(alert);
        log.warn("Alert raised: [{}] {} - {}", severity, title, message);
        return alert;
    }

    public AlertPage getAlerts(AlertFilter filter) {
        return new AlertPage(store.countActive(), store.find(filter));
    }

    /**
     * Resolves an alert. Resolving an already resolved alert returns it unchanged.
     *
     * @throws AlertNotFoundException if no alert has {@code id}
     */
    public Alert resolve(String id, String resolvedBy, String resolutionMessage) {
        Alert alert = store.findById(id).orElseThrow(() -> new AlertNotFoundException(id));
        if (alert.status() == AlertStatus.RESOLVED) {
            return alert;
        }
        Alert resolved = alert.resolve(resolvedBy, resolutionMessage, clock.instant());
        store.update(resolved);
        log.info("Alert {} resolved by {}", id, resolvedBy);
        return resolved;
    }

    /** Active alert counts for every severity, zero where none is active. */
    public Map<AlertSeverity, Long> activeCounts() {
        Map<AlertSeverity, Long> counts = new EnumMap<>(AlertSeverity.class);
        for (AlertSeverity severity : AlertSeverity.values()) {
            counts.put(severity, 0L);
        }
        counts.putAll(store.countActiveBySeverity());
        return counts;
    }
}
