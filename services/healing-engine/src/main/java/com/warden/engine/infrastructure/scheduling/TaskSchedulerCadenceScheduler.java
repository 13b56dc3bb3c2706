package com.warden.engine.infrastructure.scheduling;

import com.warden.engine.config.SchedulerProperties;
import com.warden.engine.domain.monitoring.Cadence;
import com.warden.engine.domain.monitoring.CadenceScheduler;
import com.warden.engine.domain.monitoring.Cancellable;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

/**
 * {@link CadenceScheduler} on a Spring {@link TaskScheduler}. Fast and medium lanes run with a fixed
 * delay after the configured initial delay; the daily lane follows its cron expression. Neither
 * form starts a lane before its previous run has returned.
 */
public class TaskSchedulerCadenceScheduler implements CadenceScheduler {

    private final TaskScheduler taskScheduler;
    private final SchedulerProperties properties;
    private final Clock clock;

    public TaskSchedulerCadenceScheduler(TaskScheduler taskScheduler, SchedulerProperties properties, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Cancellable schedule(Cadence cadence, Runnable lane) {
        Instant start = clock.instant().plus(properties.initialDelay());
        ScheduledFuture<?> future;
        switch (cadence) {
            case FAST:
                future = taskScheduler.scheduleWithFixedDelay(lane, start, properties.fastInterval());
                break;
            case MEDIUM:
                future = taskScheduler.scheduleWithFixedDelay(lane, start, properties.mediumInterval());
                break;
            case DAILY:
                future = taskScheduler.schedule(lane, new CronTrigger(properties.dailyCron()));
                break;
            default:
                throw new IllegalArgumentException("Unsupported cadence: " + cadence);
        }
        return () -> future.cancel(false);
    }
}
