package com.warden.engine.domain.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of {@link MetricsSnapshot}s. Safe for concurrent writers.
 */
public interface MetricsStore {

    void append(MetricsSnapshot snapshot);

    /** The most recent snapshot, if any has been written. */
    Optional<MetricsSnapshot> latest();

    /** Field means over snapshots taken at or after {@code since}; empty if there are none. */
    Optional<MetricAverages> averageSince(Instant since);

    /** Snapshots taken at or after {@code since}, oldest first. */
    List<MetricsSnapshot> since(Instant since);
}
