package com.warden.engine.domain.queue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of queues the engine monitors, in configuration order.
 */
public final class JobQueues {

    private final Map<String, JobQueue> queues;

    public JobQueues(List<? extends JobQueue> queues) {
        Map<String, JobQueue> byName = new LinkedHashMap<>();
        for (JobQueue queue : queues) {
            if (byName.putIfAbsent(queue.name(), queue) != null) {
                throw new IllegalArgumentException("Duplicate queue name: " + queue.name());
            }
        }
        this.queues = Collections.unmodifiableMap(byName);
    }

    public List<JobQueue> all() {
        return List.copyOf(queues.values());
    }

    public Optional<JobQueue> find(String name) {
        return Optional.ofNullable(queues.get(name));
    }

    public JobQueue require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown queue: " + name));
    }

    public int size() {
        return queues.size();
    }
}
