package com.warden.engine.config;

import com.warden.engine.domain.metrics.ResourceUsageProvider;
import com.warden.engine.domain.notification.NotificationChannel;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.domain.recovery.DiskRemediation;
import com.warden.engine.domain.recovery.FileJanitor;
import com.warden.engine.domain.recovery.MemoryRemediation;
import com.warden.engine.domain.recovery.QueueRemediation;
import com.warden.engine.domain.recovery.RecoveryAuditSink;
import com.warden.engine.domain.recovery.RecoveryEngine;
import com.warden.engine.domain.recovery.RecoveryGuard;
import com.warden.engine.domain.recovery.SharedCache;
import com.warden.engine.domain.recovery.WorkerRegistry;
import com.warden.engine.infrastructure.redis.RedisSharedCache;
import com.warden.observability.MetricFactory;
import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Recovery engine with the queue, memory and disk remediation areas, in that order.
 */
@Configuration
public class RecoveryConfig {

    static final String SHARED_CACHE_PREFIX = "warden:cache:";

    @Bean
    public SharedCache sharedCache(StringRedisTemplate redis) {
        return new RedisSharedCache(redis, SHARED_CACHE_PREFIX);
    }

    @Bean
    public FileJanitor fileJanitor(Clock clock) {
        return new FileJanitor(clock);
    }

    @Bean
    public RecoveryEngine recoveryEngine(
            JobQueues queues,
            ResourceUsageProvider usage,
            SharedCache cache,
            WorkerRegistry workers,
            FileJanitor janitor,
            RemediationProperties remediation,
            RecoveryAuditSink auditSink,
            NotificationChannel notifications,
            MetricFactory metrics,
            Clock clock) {
        return new RecoveryEngine(
                new RecoveryGuard(),
                List.of(
                        new QueueRemediation(queues, remediation, clock),
                        new MemoryRemediation(usage, cache, workers, janitor, remediation),
                        new DiskRemediation(janitor, remediation)),
                auditSink,
                notifications,
                metrics,
                clock);
    }
}
