package com.warden.engine.infrastructure.system;

import com.warden.engine.domain.metrics.ResourceUsageProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads heap usage from {@link Runtime} and disk usage from the {@link FileStore} of a path.
 */
public class RuntimeResourceUsageProvider implements ResourceUsageProvider {

    private final Runtime runtime;

    public RuntimeResourceUsageProvider() {
        this(Runtime.getRuntime());
    }

    RuntimeResourceUsageProvider(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public double memoryUsagePct() {
        long used = runtime.totalMemory() - runtime.freeMemory();
        return percentage(used, runtime.maxMemory());
    }

    @Override
    public double diskUsagePct(Path path) {
        try {
            FileStore store = Files.getFileStore(path);
            long total = store.getTotalSpace();
            return percentage(total - store.getUsableSpace(), total);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read file store of " + path, e);
        }
    }

    static double percentage(long used, long total) {
        if (total <= 0) {
            return 0;
        }
        return Math.max(0, Math.min(100, used * 100.0 / total));
    }
}
