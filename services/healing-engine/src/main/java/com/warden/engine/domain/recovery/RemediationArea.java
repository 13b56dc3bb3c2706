package com.warden.engine.domain.recovery;

import com.warden.observability.HealthReport;

/**
 * Fixed catalog of remediation steps for one health component.
 */
public interface RemediationArea {

    /** Health component this area remediates ({@code queues}, {@code memory}, {@code disk}). */
    String component();

    /**
     * Runs every step in order. Must not throw: step failures are reported in the outcome.
     */
    AreaOutcome remediate(HealthReport trigger);
}
