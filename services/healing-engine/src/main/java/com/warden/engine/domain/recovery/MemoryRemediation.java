package com.warden.engine.domain.recovery;

import com.warden.engine.config.RemediationProperties;
import com.warden.engine.domain.metrics.ResourceUsageProvider;
import com.warden.observability.HealthReport;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memory pressure remediation: clear the shared cache, restart bloated workers, remove stale
 * temporary files.
 */
public class MemoryRemediation implements RemediationArea {

    public static final String COMPONENT = "memory";

    private static final Logger log = LoggerFactory.getLogger(MemoryRemediation.class);
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final ResourceUsageProvider usage;
    private final SharedCache cache;
    private final WorkerRegistry workers;
    private final FileJanitor janitor;
    private final RemediationProperties properties;

    public MemoryRemediation(
            ResourceUsageProvider usage,
            SharedCache cache,
            WorkerRegistry workers,
            FileJanitor janitor,
            RemediationProperties properties) {
        this.usage = usage;
        this.cache = cache;
        this.workers = workers;
        this.janitor = janitor;
        this.properties = properties;
    }

    @Override
    public String component() {
        return COMPONENT;
    }

    @Override
    public AreaOutcome remediate(HealthReport trigger) {
        return AreaOutcome.of(List.of(
                RemediationSteps.attempt("clear shared cache", this::clearCacheUnderPressure),
                RemediationSteps.attempt("restart high-memory workers", this::restartHeavyWorkers),
                RemediationSteps.attempt("clean up temporary files", this::removeTempFiles)));
    }

    private StepOutcome clearCacheUnderPressure() {
        double usagePct = usage.memoryUsagePct();
        if (usagePct <= properties.memoryHardPct()) {
            return StepOutcome.quiet();
        }
        long cleared = cache.clear();
        log.info("Cleared {} shared cache entries", cleared);
        return StepOutcome.done(String.format(
                Locale.ROOT, "Cleared shared cache due to high memory usage (%.1f%%)", usagePct));
    }

    private StepOutcome restartHeavyWorkers() {
        long ceiling = properties.workerMemoryCeilingMb() * BYTES_PER_MB;
        int restarted = 0;
        int failed = 0;
        String lastError = null;
        for (WorkerHandle worker : workers.workers()) {
            if (worker.memoryUsageBytes() <= ceiling) {
                continue;
            }
            try {
                worker.restart();
                restarted++;
            } catch (RuntimeException e) {
                failed++;
                lastError = e.getMessage();
                log.warn("Worker {} could not be restarted: {}", worker.id(), e.getMessage());
            }
        }
        String message = restarted > 0 ? "Restarted " + restarted + " workers with high memory usage" : null;
        if (failed > 0) {
            String failure = failed + " workers failed to restart: " + lastError;
            return StepOutcome.failed(message == null ? failure : message + ", " + failure);
        }
        return message == null ? StepOutcome.quiet() : StepOutcome.done(message);
    }

    private StepOutcome removeTempFiles() throws Exception {
        int removed = janitor.deleteOlderThan(Path.of(properties.tempDir()), properties.tempMaxAge());
        return removed > 0 ? StepOutcome.done("Cleaned up " + removed + " temporary files") : StepOutcome.quiet();
    }
}
