package com.warden.engine.domain.monitoring;

/**
 * The proactive monitoring lanes.
 */
public enum Cadence {
    /** Every minute by default: snapshot, health check, recovery, early warnings. */
    FAST("fast"),
    /** Every ten minutes by default: anomaly detection and resource forecasts. */
    MEDIUM("medium"),
    /** Once a day: system health report. */
    DAILY("daily");

    private final String laneName;

    Cadence(String laneName) {
        this.laneName = laneName;
    }

    public String laneName() {
        return laneName;
    }
}
