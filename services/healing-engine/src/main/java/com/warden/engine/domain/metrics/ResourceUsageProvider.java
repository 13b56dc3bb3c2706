package com.warden.engine.domain.metrics;

import java.nio.file.Path;

/**
 * Live process and host resource usage, read on demand.
 */
public interface ResourceUsageProvider {

    /** Used heap as a percentage of the maximum heap. */
    double memoryUsagePct();

    /**
     * Used space of the file store holding {@code path}, as a percentage of its total space.
     *
     * @throws java.io.UncheckedIOException if the file store cannot be read
     */
    double diskUsagePct(Path path);
}
