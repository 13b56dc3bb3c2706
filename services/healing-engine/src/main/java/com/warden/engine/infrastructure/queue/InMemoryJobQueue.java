package com.warden.engine.infrastructure.queue;

import com.warden.engine.domain.queue.JobQueue;
import com.warden.engine.domain.queue.QueueClass;
import com.warden.engine.domain.queue.QueueJob;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * In-process {@link JobQueue}. Jobs move between the waiting, active, completed, failed and
 * delayed states under the queue's monitor.
 */
public class InMemoryJobQueue implements JobQueue {

    enum State {
        WAITING,
        ACTIVE,
        COMPLETED,
        FAILED,
        DELAYED
    }

    private final String name;
    private final QueueClass queueClass;
    private final Clock clock;
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private int workers;

    public InMemoryJobQueue(String name, QueueClass queueClass, int workers, Clock clock) {
        this.name = name;
        this.queueClass = queueClass;
        this.workers = workers;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public QueueClass queueClass() {
        return queueClass;
    }

    /** Adds a waiting job and returns its id. */
    public synchronized String enqueue() {
        return add(State.WAITING).id();
    }

    /** Adds a delayed job and returns its id. */
    public synchronized String schedule() {
        return add(State.DELAYED).id();
    }

    /** Moves the oldest waiting job to the active state. */
    public synchronized QueueJob take() {
        for (Job job : jobs.values()) {
            if (job.state == State.WAITING) {
                job.transition(State.ACTIVE);
                return job;
            }
        }
        throw new IllegalStateException("Queue " + name + " has no waiting job");
    }

    /** Marks an active job completed. */
    public synchronized void complete(String jobId) {
        require(jobId, State.ACTIVE).transition(State.COMPLETED);
    }

    /** Marks an active job failed. */
    public synchronized void fail(String jobId, String reason) {
        Job job = require(jobId, State.ACTIVE);
        job.failureReason = reason;
        job.transition(State.FAILED);
    }

    @Override
    public synchronized long waitingCount() {
        return count(State.WAITING);
    }

    @Override
    public synchronized long activeCount() {
        return count(State.ACTIVE);
    }

    @Override
    public synchronized long completedCount() {
        return count(State.COMPLETED);
    }

    @Override
    public synchronized long failedCount() {
        return count(State.FAILED);
    }

    @Override
    public synchronized long delayedCount() {
        return count(State.DELAYED);
    }

    @Override
    public synchronized List<QueueJob> activeJobs() {
        return inState(State.ACTIVE);
    }

    @Override
    public synchronized List<QueueJob> failedJobs() {
        return inState(State.FAILED);
    }

    @Override
    public synchronized int cleanCompleted(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int before = jobs.size();
        jobs.values().removeIf(job -> job.state == State.COMPLETED && job.since.isBefore(cutoff));
        return before - jobs.size();
    }

    @Override
    public synchronized int workerCount() {
        return workers;
    }

    @Override
    public synchronized void scaleWorkers(int workers) {
        if (workers < 0) {
            throw new IllegalArgumentException("workers must not be negative");
        }
        this.workers = workers;
    }

    /** Failure reason of a failed job, or null. */
    public synchronized String failureReason(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? null : job.failureReason;
    }

    private Job add(State state) {
        Job job = new Job(UUID.randomUUID().toString(), state, clock.instant());
        jobs.put(job.id, job);
        return job;
    }

    private Job require(String jobId, State expected) {
        Job job = jobs.get(jobId);
        if (job == null || job.state != expected) {
            throw new IllegalStateException("Job " + jobId + " is not " + expected.name().toLowerCase(Locale.ROOT));
        }
        return job;
    }

    private long count(State state) {
        return jobs.values().stream().filter(job -> job.state == state).count();
    }

    private List<QueueJob> inState(State state) {
        List<QueueJob> result = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.state == state) {
                result.add(job);
            }
        }
        return result;
    }

    private final class Job implements QueueJob {

        private final String id;
        private State state;
        private Instant since;
        private String failureReason;

        private Job(String id, State state, Instant since) {
            this.id = id;
            this.state = state;
            this.since = since;
        }

        private void transition(State next) {
            state = next;
            since = clock.instant();
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Instant activeSince() {
            synchronized (InMemoryJobQueue.this) {
                return since;
            }
        }

        @Override
        public void moveToFailed(String reason) {
            synchronized (InMemoryJobQueue.this) {
                if (state != State.ACTIVE) {
                    throw new IllegalStateException("Job " + id + " is not active");
                }
                failureReason = reason;
                transition(State.FAILED);
            }
        }

        @Override
        public void retry() {
            synchronized (InMemoryJobQueue.this) {
                if (state == State.WAITING) {
                    return;
                }
                if (state != State.FAILED) {
                    throw new IllegalStateException("Job " + id + " is not failed");
                }
                failureReason = null;
                transition(State.WAITING);
            }
        }
    }
}
