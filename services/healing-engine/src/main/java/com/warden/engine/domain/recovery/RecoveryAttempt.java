package com.warden.engine.domain.recovery;

import com.warden.observability.HealthReport;
import java.time.Instant;
import java.util.List;

/**
 * Audit record of one recovery run.
 *
 * @param outcome {@code completed} or {@code failed}
 */
public record RecoveryAttempt(
        HealthReport trigger, List<String> actions, boolean success, String outcome, Instant attemptedAt) {

    public RecoveryAttempt {
        actions = List.copyOf(actions);
    }
}
