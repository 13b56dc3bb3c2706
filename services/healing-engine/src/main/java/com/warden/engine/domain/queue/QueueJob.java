package com.warden.engine.domain.queue;

import java.time.Instant;

/**
 * A job held by a {@link JobQueue}.
 */
public interface QueueJob {

    String id();

    /** When the job entered the active state, or when it failed for jobs in the failed state. */
    Instant activeSince();

    /** Moves an active job to the failed state with the given reason. */
    void moveToFailed(String reason);

    /** Puts a failed job back into the waiting state. Retrying a job that is already waiting is a no-op. */
    void retry();
}
