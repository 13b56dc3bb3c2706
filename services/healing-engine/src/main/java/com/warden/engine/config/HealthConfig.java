package com.warden.engine.config;

import com.warden.engine.domain.health.HealthHistory;
import com.warden.engine.domain.health.HealthProber;
import com.warden.engine.domain.health.QueueHealthCheck;
import com.warden.engine.domain.health.ResourceHealthCheck;
import com.warden.engine.domain.health.ThresholdBands;
import com.warden.engine.domain.metrics.ResourceUsageProvider;
import com.warden.engine.domain.queue.JobQueues;
import com.warden.engine.infrastructure.persistence.DatabaseHealthCheck;
import com.warden.engine.infrastructure.redis.CacheHealthCheck;
import com.warden.engine.infrastructure.redis.RedisHealthHistory;
import com.warden.engine.infrastructure.storage.StorageHealthCheck;
import com.warden.engine.infrastructure.system.RuntimeResourceUsageProvider;
import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.MetricFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Registers one probe per dependency. The storage probe is registered only when an
 * {@link S3Client} bean exists. The probe executor must have a thread for every probe.
 */
@Configuration
public class HealthConfig {

    @Bean
    public ResourceUsageProvider resourceUsageProvider() {
        return new RuntimeResourceUsageProvider();
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            ProbeProperties probes,
            StorageProperties storage,
            JdbcTemplate jdbc,
            StringRedisTemplate redis,
            ObjectProvider<S3Client> s3,
            JobQueues queues,
            ResourceUsageProvider usage,
            @Qualifier(ObservabilityConfig.PROBE_EXECUTOR) Executor executor,
            Clock clock) {
        HealthCheckRegistry registry = new HealthCheckRegistry(probes.timeoutMs(), clock);
        registry.register(DatabaseHealthCheck.NAME,
                new DatabaseHealthCheck(jdbc, Duration.ofMillis(probes.timeoutMs()), executor));
        registry.register(CacheHealthCheck.NAME, new CacheHealthCheck(redis, executor));
        s3.ifAvailable(client ->
                registry.register(StorageHealthCheck.NAME, new StorageHealthCheck(client, storage.bucket(), executor)));
        registry.register(QueueHealthCheck.NAME, new QueueHealthCheck(queues, probes, executor));

        Path diskPath = Path.of(probes.diskPath());
        registry.register("memory", new ResourceHealthCheck("memory", usage::memoryUsagePct,
                new ThresholdBands(probes.memorySoftPct(), probes.memoryHardPct()), executor));
        registry.register("disk", new ResourceHealthCheck("disk", () -> usage.diskUsagePct(diskPath),
                new ThresholdBands(probes.diskSoftPct(), probes.diskHardPct()), executor));

        // Every probe keeps at most one round-trip in flight, so one thread per probe is enough
        // for none of them to wait behind a hung dependency.
        if (registry.size() > probes.poolSize()) {
            throw new IllegalStateException("warden.probes.pool-size is " + probes.poolSize()
                    + " but " + registry.size() + " probes are registered");
        }
        return registry;
    }

    @Bean
    public HealthHistory healthHistory(StringRedisTemplate redis, ProbeProperties probes) {
        return new RedisHealthHistory(redis, probes.historyCapacity());
    }

    @Bean
    public HealthProber healthProber(HealthCheckRegistry registry, HealthHistory history, MetricFactory metrics) {
        return new HealthProber(registry, history, metrics);
    }
}
