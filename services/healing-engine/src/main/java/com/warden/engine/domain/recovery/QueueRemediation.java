package com.warden.engine.domain.recovery;

import com.warden.engine.config.RemediationProperties;
import com.warden.engine.domain.queue.JobQueue;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.domain.queue.QueueJob;
import com.warden.observability.HealthReport;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue backlog remediation: requeue stuck jobs, retry failed jobs, purge old completed jobs.
 *
 * <p>Each step walks every queue. A job that cannot be moved is counted and the step is reported
 * as failed once all jobs have been processed.
 */
public class QueueRemediation implements RemediationArea {

    public static final String COMPONENT = "queues";

    static final String STUCK_REASON = "Job stuck and requeued by recovery process";

    private static final Logger log = LoggerFactory.getLogger(QueueRemediation.class);

    private final JobQueues queues;
    private final RemediationProperties properties;
    private final Clock clock;

    public QueueRemediation(JobQueues queues, RemediationProperties properties, Clock clock) {
        this.queues = queues;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String component() {
        return COMPONENT;
    }

    @Override
    public AreaOutcome remediate(HealthReport trigger) {
        return AreaOutcome.of(List.of(
                RemediationSteps.attempt("requeue stuck jobs", this::requeueStuckJobs),
                RemediationSteps.attempt("retry failed jobs", this::retryFailedJobs),
                RemediationSteps.attempt("clean up completed jobs", this::cleanCompletedJobs)));
    }

    private StepOutcome requeueStuckJobs() {
        Instant now = clock.instant();
        JobTally tally = new JobTally();
        for (JobQueue queue : queues.all()) {
            Instant cutoff = now.minus(properties.stuckThreshold(queue.queueClass()));
            for (QueueJob job : queue.activeJobs()) {
                if (!job.activeSince().isBefore(cutoff)) {
                    continue;
                }
                try {
                    job.moveToFailed(STUCK_REASON);
                    job.retry();
                    tally.succeeded++;
                } catch (RuntimeException e) {
                    tally.fail(queue, job, e);
                }
            }
        }
        return tally.outcome("Requeued %d stuck jobs");
    }

    private StepOutcome retryFailedJobs() {
        JobTally tally = new JobTally();
        for (JobQueue queue : queues.all()) {
            for (QueueJob job : queue.failedJobs()) {
                try {
                    job.retry();
                    tally.succeeded++;
                } catch (RuntimeException e) {
                    tally.fail(queue, job, e);
                }
            }
        }
        return tally.outcome("Retried %d failed jobs");
    }

    private StepOutcome cleanCompletedJobs() {
        int removed = 0;
        for (JobQueue queue : queues.all()) {
            removed += queue.cleanCompleted(properties.completedRetention());
        }
        return StepOutcome.done("Cleaned up " + removed + " old jobs");
    }

    private static final class JobTally {

        private int succeeded;
        private int failed;
        private String lastError;

        void fail(JobQueue queue, QueueJob job, RuntimeException e) {
            failed++;
            lastError = e.getMessage();
            log.warn("Job {} in queue {} could not be moved: {}", job.id(), queue.name(), e.getMessage());
        }

        StepOutcome outcome(String format) {
            String message = String.format(format, succeeded);
            if (failed == 0) {
                return StepOutcome.done(message);
            }
            return StepOutcome.failed(message + ", " + failed + " failed: " + lastError);
        }
    }
}
