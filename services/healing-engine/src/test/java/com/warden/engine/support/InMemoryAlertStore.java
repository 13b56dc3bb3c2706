package com.warden.engine.support;

import com.warden.engine.domain.alert.Alert;
import com.warden.engine.domain.alert.AlertFilter;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.alert.AlertStatus;
import com.warden.engine.domain.alert.AlertStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * List-backed {@link AlertStore} for domain tests.
 */
public class InMemoryAlertStore implements AlertStore {

    private final Map<String, Alert> alerts = new LinkedHashMap<>();

    @Override
    public synchronized void save(Alert alert) {
        alerts.put(alert.id(), alert);
    }

    @Override
    public synchronized Optional<Alert> findById(String id) {
        return Optional.ofNullable(alerts.get(id));
    }

    @Override
    public synchronized List<Alert> find(AlertFilter filter) {
        return alerts.values().stream()
                .filter(a -> filter.status() == null || a.status() == filter.status())
                .filter(a -> filter.severity() == null || a.severity() == filter.severity())
                .sorted(Comparator.comparing(Alert::timestamp).reversed())
                .limit(filter.limit())
                .toList();
    }

    @Override
    public synchronized long countActive() {
        return alerts.values().stream().filter(Alert::isActive).count();
    }

    @Override
    public synchronized Map<AlertSeverity, Long> countActiveBySeverity() {
        Map<AlertSeverity, Long> counts = new EnumMap<>(AlertSeverity.class);
        for (Alert alert : alerts.values()) {
            if (alert.status() == AlertStatus.ACTIVE) {
                counts.merge(alert.severity(), 1L, Long::sum);
            }
        }
        return counts;
    }

    @Override
    public synchronized void update(Alert alert) {
        alerts.put(alert.id(), alert);
    }

    public synchronized List<Alert> all() {
        return new ArrayList<>(alerts.values());
    }

    public synchronized List<Alert> withTitle(String title) {
        return alerts.values().stream().filter(a -> a.title().equals(title)).toList();
    }
}
