package com.warden.engine.domain.anomaly;

/**
 * Backlog classification for one queue.
 *
 * @param systematic true when the backlog is sustained rather than a one-off spike
 * @param currentWorkers workers consuming the queue when analysed
 * @param recommendedWorkers never below {@code currentWorkers}
 */
public record QueuePattern(String queue, boolean systematic, int currentWorkers, int recommendedWorkers) {

    public boolean scalingRecommended() {
        return recommendedWorkers > currentWorkers;
    }
}
