package com.warden.engine.config;

import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.infrastructure.queue.InMemoryJobQueue;
import com.warden.engine.infrastructure.queue.InMemoryWorkerRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue backends and the worker registry.
 */
@Configuration
public class QueueConfig {

    @Bean
    public JobQueues jobQueues(QueueProperties properties, Clock clock) {
        return new JobQueues(properties.definitions().stream()
                .map(def -> new InMemoryJobQueue(def.name(), def.queueClass(), def.workers(), clock))
                .toList());
    }

    @Bean
    public InMemoryWorkerRegistry workerRegistry() {
        return new InMemoryWorkerRegistry();
    }
}
