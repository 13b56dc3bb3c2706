package com.warden.engine.domain.health;

import com.warden.observability.HealthCheckRegistry;
import com.warden.observability.HealthReport;
import com.warden.observability.HealthStatus;
import com.warden.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every registered probe concurrently, reduces the results to one {@link HealthReport} and
 * appends it to the {@link HealthHistory}.
 *
 * <p>The history write is best-effort: a failure is logged and the report is still returned.
 */
public class HealthProber {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    private final HealthCheckRegistry registry;
    private final HealthHistory history;
    private final Timer checkTimer;
    private final AtomicLong lastSeverity;

    public HealthProber(HealthCheckRegistry registry, HealthHistory history, MetricFactory metrics) {
        this.registry = registry;
        this.history = history;
        this.checkTimer = metrics.timer("warden.health.check", "Duration of a full health check");
        this.lastSeverity = metrics.gauge("warden.health.status",
                "Aggregate health severity (0 healthy, 1 degraded, 2 unhealthy)");
    }

    /**
     * Probes every dependency and returns the aggregate report. Never throws for probe failures.
     */
    public HealthReport checkHealth() {
        HealthReport report = checkTimer.record(registry::checkAll);
        lastSeverity.set(report.status().ordinal());

        if (report.status() != HealthStatus.HEALTHY) {
            log.warn("System health is {}: {}", report.status(), summarize(report));
        } else {
            log.debug("System health is HEALTHY ({} components)", report.components().size());
        }

        try {
            history.append(report);
        } catch (RuntimeException e) {
            log.warn("Failed to record health report in history: {}", e.getMessage());
        }
        return report;
    }

    /**
     * Returns up to {@code limit} recent reports, newest first.
     *
     * @throws IllegalArgumentException if {@code limit} is outside 1..capacity
     */
    public List<HealthReport> recentHealth(int limit) {
        if (limit < 1 || limit > history.capacity()) {
            throw new IllegalArgumentException("limit must be between 1 and " + history.capacity());
        }
        return history.recent(limit);
    }

    private static String summarize(HealthReport report) {
        return report.components().values().stream()
                .filter(c -> c.status() != HealthStatus.HEALTHY)
                .map(c -> c.name() + "=" + c.status() + (c.error() != null ? " (" + c.error() + ")" : ""))
                .collect(Collectors.joining(", "));
    }
}
