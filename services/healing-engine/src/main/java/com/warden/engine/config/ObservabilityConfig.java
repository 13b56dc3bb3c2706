package com.warden.engine.config;

import com.warden.observability.MetricFactory;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Clock, metrics, tracing, redaction and the probe executor shared by the engine.
 */
@Configuration
public class ObservabilityConfig {

    public static final String PROBE_EXECUTOR = "probeExecutor";
    public static final String QUEUE_SAMPLING_EXECUTOR = "queueSamplingExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name(), service.environment());
    }

    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        // No SDK is configured here; without one on the classpath spans are no-ops.
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    /** Bounded pool for health probes. */
    @Bean(name = PROBE_EXECUTOR)
    public ThreadPoolTaskExecutor probeExecutor(ProbeProperties probes) {
        return boundedPool(probes.poolSize(), "warden-probe-");
    }

    /** Separate pool for the aggregator's parallel queue sampling, so it never delays a probe. */
    @Bean(name = QUEUE_SAMPLING_EXECUTOR)
    public ThreadPoolTaskExecutor queueSamplingExecutor(ProbeProperties probes) {
        return boundedPool(probes.poolSize(), "warden-queue-stats-");
    }

    private static ThreadPoolTaskExecutor boundedPool(int size, String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size * 10);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
