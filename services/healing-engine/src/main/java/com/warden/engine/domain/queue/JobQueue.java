package com.warden.engine.domain.queue;

import java.time.Duration;
import java.util.List;

/**
 * Background queue backend as seen by the engine.
 *
 * <p>Count methods may be called concurrently from probe threads. Implementations throw a runtime
 * exception when the backend cannot be reached.
 */
public interface JobQueue {

    String name();

    QueueClass queueClass();

    long waitingCount();

    long activeCount();

    long completedCount();

    long failedCount();

    long delayedCount();

    List<QueueJob> activeJobs();

    List<QueueJob> failedJobs();

    /**
     * Removes completed jobs that finished more than {@code olderThan} ago.
     *
     * @return number of jobs removed
     */
    int cleanCompleted(Duration olderThan);

    int workerCount();

    /** Sets the number of workers consuming this queue. */
    void scaleWorkers(int workers);
}
