package com.warden.engine.domain.recovery;

import com.warden.engine.config.RemediationProperties;
import com.warden.observability.HealthReport;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Disk pressure remediation. Re-running against the same directories removes nothing further.
 */
public class DiskRemediation implements RemediationArea {

    public static final String COMPONENT = "disk";

    private final FileJanitor janitor;
    private final RemediationProperties properties;

    public DiskRemediation(FileJanitor janitor, RemediationProperties properties) {
        this.janitor = janitor;
        this.properties = properties;
    }

    @Override
    public String component() {
        return COMPONENT;
    }

    @Override
    public AreaOutcome remediate(HealthReport trigger) {
        List<StepOutcome> steps = new ArrayList<>();
        steps.add(RemediationSteps.attempt("remove old log files", () -> {
            int removed = janitor.deleteOlderThan(Path.of(properties.logDir()), properties.logRetention());
            return StepOutcome.done("Removed " + removed + " old log files");
        }));
        steps.add(RemediationSteps.attempt("remove temporary upload files", () -> {
            int removed = janitor.deleteOlderThan(
                    Path.of(properties.uploadTempDir()), properties.uploadTempMaxAge());
            return StepOutcome.done("Removed " + removed + " temporary upload files");
        }));
        steps.add(RemediationSteps.attempt("remove failed upload chunks", () -> {
            int removed = janitor.deleteOlderThan(Path.of(properties.chunkDir()), properties.chunkMaxAge());
            return StepOutcome.done("Removed " + removed + " failed upload chunks");
        }));
        if (properties.compressEnabled()) {
            steps.add(RemediationSteps.attempt("compress old files", () -> {
                int compressed = janitor.compressOlderThan(
                        Path.of(properties.compressDir()), properties.compressAfter());
                return compressed > 0 ? StepOutcome.done("Compressed " + compressed + " old files") : StepOutcome.quiet();
            }));
        }
        return AreaOutcome.of(steps);
    }
}
