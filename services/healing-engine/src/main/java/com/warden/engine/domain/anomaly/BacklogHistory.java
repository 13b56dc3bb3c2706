package com.warden.engine.domain.anomaly;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent waiting-job counts per queue, bounded per queue. Fed by the fast cadence.
 */
public class BacklogHistory {

    private final int capacity;
    private final Map<String, Deque<Long>> samples = new ConcurrentHashMap<>();

    public BacklogHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void record(String queue, long waiting) {
        Deque<Long> deque = samples.computeIfAbsent(queue, q -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(waiting);
            while (deque.size() > capacity) {
                deque.removeFirst();
            }
        }
    }

    /** Samples for {@code queue}, oldest first. */
    public List<Long> samples(String queue) {
        Deque<Long> deque = samples.get(queue);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return List.copyOf(deque);
        }
    }
}
