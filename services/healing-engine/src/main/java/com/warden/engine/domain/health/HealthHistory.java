package com.warden.engine.domain.health;

import com.warden.observability.HealthReport;
import java.util.List;

/**
 * Time-ordered, capped log of health reports.
 */
public interface HealthHistory {

    /** Appends a report and trims the log to its capacity, dropping the oldest entries. */
    void append(HealthReport report);

    /** Returns up to {@code limit} reports, newest first. */
    List<HealthReport> recent(int limit);

    int capacity();
}
