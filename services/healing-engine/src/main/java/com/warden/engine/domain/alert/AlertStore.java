package com.warden.engine.domain.alert;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent alert storage.
 */
public interface AlertStore {

    void save(Alert alert);

    Optional<Alert> findById(String id);

    /** Alerts matching {@code filter}, newest first, at most {@code filter.limit()}. */
    List<Alert> find(AlertFilter filter);

    long countActive();

    /** Active alert counts keyed by severity; severities with no active alert may be absent. */
    Map<AlertSeverity, Long> countActiveBySeverity();

    /** Replaces the stored alert with the same id. */
    void update(Alert alert);
}
