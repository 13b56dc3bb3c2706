package com.warden.engine.domain.queue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw counts of one queue, sampled in a single pass.
 *
 * @param errorRate {@code failed / (completed + failed)}, or 0 when no job has finished yet
 */
public record QueueMetrics(
        long waiting, long active, long completed, long failed, long delayed, double errorRate) {

    /** Samples every count of {@code queue}. Propagates backend failures. */
    public static QueueMetrics sample(JobQueue queue) {
        long waiting = queue.waitingCount();
        long active = queue.activeCount();
        long completed = queue.completedCount();
        long failed = queue.failedCount();
        long delayed = queue.delayedCount();
        return new QueueMetrics(waiting, active, completed, failed, delayed, errorRate(completed, failed));
    }

    static double errorRate(long completed, long failed) {
        long finished = completed + failed;
        return finished == 0 ? 0.0 : (double) failed / finished;
    }

    /** Field map used in health detail and notification payloads. */
    public Map<String, Object> toDetail() {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("waiting", waiting);
        detail.put("active", active);
        detail.put("completed", completed);
        detail.put("failed", failed);
        detail.put("delayed", delayed);
        detail.put("errorRate", errorRate);
        return detail;
    }
}
