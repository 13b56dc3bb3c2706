package com.warden.engine.domain.monitoring;

import com.warden.engine.domain.metrics.ErrorLogEntry;
import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the three monitoring lanes with a {@link CadenceScheduler}.
 *
 * <p>Every lane execution gets a fresh correlation context and its own span. A failing lane is
 * logged, counted and written to the error log under its origin ({@code scheduler:<lane>}); it never
 * affects the other lanes or its own next run. An execution requested while the same lane is still
 * running is dropped.
 */
public class ProactiveScheduler {

    private static final Logger log = LoggerFactory.getLogger(ProactiveScheduler.class);

    static final String ORIGIN_PREFIX = "scheduler:";

    private final CadenceScheduler scheduler;
    private final SpanHelper spans;
    private final ErrorLogStore errorLog;
    private final Clock clock;
    private final Map<Cadence, Runnable> lanes = new EnumMap<>(Cadence.class);
    private final Map<Cadence, AtomicBoolean> running = new EnumMap<>(Cadence.class);
    private final Map<Cadence, Counter> failures = new EnumMap<>(Cadence.class);
    private final List<Cancellable> handles = new ArrayList<>();

    public ProactiveScheduler(CadenceScheduler scheduler, ProactiveMonitor monitor, DailyHealthReporter reporter,
                              SpanHelper spans, MetricFactory metrics, ErrorLogStore errorLog, Clock clock) {
        this.scheduler = scheduler;
        this.spans = spans;
        this.errorLog = errorLog;
        this.clock = clock;
        lanes.put(Cadence.FAST, monitor::runFastCycle);
        lanes.put(Cadence.MEDIUM, monitor::runMediumCycle);
        lanes.put(Cadence.DAILY, reporter::sendReport);
        for (Cadence cadence : Cadence.values()) {
            running.put(cadence, new AtomicBoolean(false));
            failures.put(cadence, metrics.counter("warden.lane.failures", "Monitoring lane executions that failed",
                    "lane", cadence.laneName()));
        }
    }

    public synchronized void start() {
        if (!handles.isEmpty()) {
            return;
        }
        for (Cadence cadence : Cadence.values()) {
            handles.add(scheduler.schedule(cadence, () -> runLane(cadence)));
        }
        log.info("Proactive monitoring started with {} lanes", handles.size());
    }

    public synchronized void stop() {
        handles.forEach(Cancellable::cancel);
        if (!handles.isEmpty()) {
            log.info("Proactive monitoring stopped");
        }
        handles.clear();
    }

    public synchronized boolean isRunning() {
        return !handles.isEmpty();
    }

    /**
     * Runs one execution of {@code cadence} on the calling thread.
     *
     * @return false if the lane was already running and this execution was dropped
     */
    public boolean runLane(Cadence cadence) {
        AtomicBoolean flag = running.get(cadence);
        if (!flag.compareAndSet(false, true)) {
            log.warn("Lane {} is still running, skipping this execution", cadence.laneName());
            return false;
        }
        try {
            String origin = ORIGIN_PREFIX + cadence.laneName();
            CorrelationContextHolder.runWithContext(CorrelationContext.generate(origin), () -> {
                try {
                    spans.traceLane(cadence.laneName(), lanes.get(cadence));
                } catch (RuntimeException e) {
                    failures.get(cadence).increment();
                    log.error("Lane {} failed", cadence.laneName(), e);
                    recordFailure(origin, e);
                }
            });
            return true;
        } finally {
            flag.set(false);
        }
    }

    private void recordFailure(String origin, RuntimeException failure) {
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        try {
            errorLog.record(new ErrorLogEntry(origin, message, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to record error log entry for {}: {}", origin, e.getMessage());
        }
    }
}
