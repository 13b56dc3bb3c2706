package com.warden.engine.domain.recovery;

import java.time.Instant;
import java.util.List;

/**
 * Durable log of recovery attempts.
 */
public interface RecoveryAuditSink {

    void record(RecoveryAttempt attempt);

    /** Attempts made at or after {@code since}, newest first. */
    List<RecoveryAttempt> since(Instant since);
}
