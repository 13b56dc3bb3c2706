package com.warden.engine.domain.metrics;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of {@link ApiCall}s.
 */
public interface ApiMetricsStore {

    void record(ApiCall call);

    /** Calls recorded at or after {@code since}, oldest first. */
    List<ApiCall> since(Instant since);
}
