package com.warden.engine.domain.metrics;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of {@link ErrorLogEntry}s.
 */
public interface ErrorLogStore {

    void record(ErrorLogEntry entry);

    /** Entries recorded at or after {@code since}, oldest first. */
    List<ErrorLogEntry> since(Instant since);

    /**
     * Entries recorded between {@code from} and {@code to}, both inclusive, oldest first.
     *
     * @param component only entries of this component, or every component when {@code null}
     */
    List<ErrorLogEntry> between(String component, Instant from, Instant to);
}
