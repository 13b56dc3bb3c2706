package com.warden.engine.domain.anomaly;

import com.warden.engine.config.DetectionProperties;
import com.warden.engine.domain.queue.JobQueue;
import com.warden.engine.domain.queue.JobQueues;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Statistical anomaly test and queue backlog pattern analysis. Has no side effects.
 *
 * <p>A value is anomalous when {@code |current - mean| > sigma * stdDev}, with the population
 * standard deviation of the historical series. An empty series never yields an anomaly. A
 * zero-variance series flags any value that differs from the mean and never flags the mean
 * itself.
 */
public class AnomalyDetector {

    private final double sigma;
    private final DetectionProperties detection;
    private final int queueLengthThreshold;
    private final BacklogHistory backlogHistory;
    private final JobQueues queues;
    private final Clock clock;

    public AnomalyDetector(DetectionProperties detection, int queueLengthThreshold, BacklogHistory backlogHistory,
                           JobQueues queues, Clock clock) {
        this.sigma = detection.sigmaThreshold();
        this.detection = detection;
        this.queueLengthThreshold = queueLengthThreshold;
        this.backlogHistory = backlogHistory;
        this.queues = queues;
        this.clock = clock;
    }

    public boolean isAnomaly(double current, List<Double> historical) {
        if (historical.isEmpty()) {
            return false;
        }
        double mean = 0;
        for (double x : historical) {
            mean += x;
        }
        mean /= historical.size();

        double variance = 0;
        for (double x : historical) {
            variance += (x - mean) * (x - mean);
        }
        double stdDev = Math.sqrt(variance / historical.size());

        return Math.abs(current - mean) > sigma * stdDev;
    }

    public Optional<Anomaly> detect(String metricType, double current, List<Double> historical) {
        if (!isAnomaly(current, historical)) {
            return Optional.empty();
        }
        return Optional.of(new Anomaly(metricType, current, historical, clock.instant()));
    }

    /**
     * Classifies the backlog of {@code queueName} from its recent samples.
     *
     * <p>Systematic when at least {@code backlogMinSamples} samples exist and at least {@code
     * backlogSystematicFraction} of them exceed the queue-length threshold. A systematic backlog
     * recommends one extra worker per {@code backlogPerWorker} waiting jobs of the latest sample,
     * capped at {@code maxWorkers}; the recommendation never drops below the current worker count.
     *
     * @throws IllegalArgumentException if the queue is unknown
     */
    public QueuePattern analyzeQueuePatterns(String queueName) {
        JobQueue queue = queues.require(queueName);
        int current = queue.workerCount();
        List<Long> samples = backlogHistory.samples(queueName);

        if (samples.size() < detection.backlogMinSamples()) {
            return new QueuePattern(queueName, false, current, current);
        }
        long above = samples.stream().filter(s -> s > queueLengthThreshold).count();
        boolean systematic = above >= Math.ceil(detection.backlogSystematicFraction() * samples.size());
        if (!systematic) {
            return new QueuePattern(queueName, false, current, current);
        }

        long backlog = samples.get(samples.size() - 1);
        long extra = (backlog + detection.backlogPerWorker() - 1) / detection.backlogPerWorker();
        int recommended = (int) Math.min(detection.maxWorkers(), current + extra);
        return new QueuePattern(queueName, true, current, Math.max(current, recommended));
    }
}
