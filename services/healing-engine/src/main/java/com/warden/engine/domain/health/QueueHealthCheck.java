package com.warden.engine.domain.health;

import com.warden.engine.config.ProbeProperties;
import com.warden.engine.domain.queue.JobQueue;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.domain.queue.QueueMetrics;
import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthStatus;
import com.warden.observability.TimedHealthCheck;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Classifies every monitored queue by failure rate and delayed backlog and reports the worst.
 *
 * <p>A queue is unhealthy above {@code queueFailureRate} or {@code queueDelayed}, and degraded
 * above {@code degradedFactor} times either threshold. A queue whose backend cannot be read is
 * unhealthy; the remaining queues are still sampled.
 */
public class QueueHealthCheck extends TimedHealthCheck {

    public static final String NAME = "queues";

    private final JobQueues queues;
    private final ProbeProperties probes;

    public QueueHealthCheck(JobQueues queues, ProbeProperties probes, Executor executor) {
        super(NAME, executor);
        this.queues = queues;
        this.probes = probes;
    }

    @Override
    protected ComponentHealth probe(long startNanos) {
        HealthStatus worst = HealthStatus.HEALTHY;
        Map<String, Object> detail = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();

        for (JobQueue queue : queues.all()) {
            Map<String, Object> queueDetail;
            HealthStatus status;
            try {
                QueueMetrics metrics = QueueMetrics.sample(queue);
                status = classify(metrics);
                queueDetail = metrics.toDetail();
                if (status != HealthStatus.HEALTHY) {
                    problems.add(describe(queue.name(), metrics));
                }
            } catch (RuntimeException e) {
                status = HealthStatus.UNHEALTHY;
                queueDetail = new LinkedHashMap<>();
                queueDetail.put("error", String.valueOf(e.getMessage()));
                problems.add(queue.name() + ": " + e.getMessage());
            }
            queueDetail.put("status", status.wireName());
            detail.put(queue.name(), queueDetail);
            worst = worst.worse(status);
        }

        String error = problems.isEmpty() ? null : String.join("; ", problems);
        return new ComponentHealth(NAME, worst, elapsedMs(startNanos), error, detail);
    }

    /** Classifies one queue's metrics. */
    public HealthStatus classify(QueueMetrics metrics) {
        double failureRate = probes.queueFailureRate();
        double delayed = probes.queueDelayed();
        if (metrics.errorRate() > failureRate || metrics.delayed() > delayed) {
            return HealthStatus.UNHEALTHY;
        }
        double factor = probes.degradedFactor();
        if (metrics.errorRate() > failureRate * factor || metrics.delayed() > delayed * factor) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    private static String describe(String queue, QueueMetrics metrics) {
        return String.format(Locale.ROOT, "%s: errorRate=%.3f delayed=%d",
                queue, metrics.errorRate(), metrics.delayed());
    }
}
