package com.warden.engine.config;

import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.engine.domain.monitoring.CadenceScheduler;
import com.warden.engine.domain.monitoring.DailyHealthReporter;
import com.warden.engine.domain.monitoring.ProactiveMonitor;
import com.warden.engine.domain.monitoring.ProactiveScheduler;
import com.warden.engine.infrastructure.scheduling.TaskSchedulerCadenceScheduler;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Monitoring lanes on a dedicated scheduler pool, one thread per lane. Lanes start once the
 * application is ready, after schema migration.
 */
@Configuration
@ConditionalOnProperty(prefix = "warden.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler wardenTaskScheduler(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.poolSize());
        scheduler.setThreadNamePrefix("warden-lane-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    public CadenceScheduler cadenceScheduler(ThreadPoolTaskScheduler wardenTaskScheduler,
                                             SchedulerProperties properties, Clock clock) {
        return new TaskSchedulerCadenceScheduler(wardenTaskScheduler, properties, clock);
    }

    @Bean(destroyMethod = "stop")
    public ProactiveScheduler proactiveScheduler(CadenceScheduler cadenceScheduler, ProactiveMonitor monitor,
                                                 DailyHealthReporter reporter, SpanHelper spans,
                                                 MetricFactory metrics, ErrorLogStore errorLog, Clock clock) {
        return new ProactiveScheduler(cadenceScheduler, monitor, reporter, spans, metrics, errorLog, clock);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startLanes(ApplicationReadyEvent event) {
        event.getApplicationContext().getBean(ProactiveScheduler.class).start();
    }
}
