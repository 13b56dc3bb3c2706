package com.warden.engine.infrastructure.system;

import com.warden.engine.domain.metrics.MetricsSampler;
import com.warden.engine.domain.metrics.MetricsSnapshot;
import com.warden.engine.domain.metrics.ResourceUsageProvider;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples the host through the platform {@code OperatingSystemMXBean} and, where present, the
 * Linux {@code /proc} files. Counters that cannot be read on this platform are reported as zero.
 */
public class SystemMetricsSampler implements MetricsSampler {

    private static final Logger log = LoggerFactory.getLogger(SystemMetricsSampler.class);

    static final String TCP_ESTABLISHED = "01";

    private final ResourceUsageProvider usage;
    private final Path diskPath;
    private final Path procRoot;
    private final Clock clock;

    public SystemMetricsSampler(ResourceUsageProvider usage, Path diskPath, Clock clock) {
        this(usage, diskPath, Path.of("/proc"), clock);
    }

    SystemMetricsSampler(ResourceUsageProvider usage, Path diskPath, Path procRoot, Clock clock) {
        this.usage = usage;
        this.diskPath = diskPath;
        this.procRoot = procRoot;
        this.clock = clock;
    }

    @Override
    public MetricsSnapshot sample() {
        long[] network = networkBytes();
        return new MetricsSnapshot(
                clock.instant(),
                cpuUsagePct(),
                usage.memoryUsagePct(),
                usage.diskUsagePct(diskPath),
                network[0],
                network[1],
                establishedConnections(),
                loadAverage());
    }

    double cpuUsagePct() {
        java.lang.management.OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) os).getCpuLoad();
            if (load >= 0) {
                return Math.round(load * 1000) / 10.0;
            }
        }
        return 0;
    }

    /** Received and sent bytes summed over every interface except loopback. */
    long[] networkBytes() {
        long[] totals = new long[2];
        for (String line : readLines(procRoot.resolve("net/dev"))) {
            int colon = line.indexOf(':');
            if (colon < 0 || line.substring(0, colon).trim().equals("lo")) {
                continue;
            }
            String[] fields = line.substring(colon + 1).trim().split("\\s+");
            if (fields.length >= 9) {
                totals[0] += parseLong(fields[0]);
                totals[1] += parseLong(fields[8]);
            }
        }
        return totals;
    }

    int establishedConnections() {
        int count = 0;
        for (String file : List.of("net/tcp", "net/tcp6")) {
            List<String> lines = readLines(procRoot.resolve(file));
            for (int i = 1; i < lines.size(); i++) {
                String[] fields = lines.get(i).trim().split("\\s+");
                if (fields.length > 3 && TCP_ESTABLISHED.equals(fields[3])) {
                    count++;
                }
            }
        }
        return count;
    }

    MetricsSnapshot.LoadAverage loadAverage() {
        List<String> lines = readLines(procRoot.resolve("loadavg"));
        if (!lines.isEmpty()) {
            String[] fields = lines.get(0).trim().split("\\s+");
            if (fields.length >= 3) {
                return new MetricsSnapshot.LoadAverage(
                        parseDouble(fields[0]), parseDouble(fields[1]), parseDouble(fields[2]));
            }
        }
        double oneMinute = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        return oneMinute < 0
                ? MetricsSnapshot.LoadAverage.UNAVAILABLE
                : new MetricsSnapshot.LoadAverage(oneMinute, 0, 0);
    }

    private static List<String> readLines(Path file) {
        if (!Files.isReadable(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
