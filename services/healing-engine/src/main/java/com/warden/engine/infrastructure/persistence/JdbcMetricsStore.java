package com.warden.engine.infrastructure.persistence;

import com.warden.engine.domain.metrics.MetricAverages;
import com.warden.engine.domain.metrics.MetricsSnapshot;
import com.warden.engine.domain.metrics.MetricsStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link MetricsStore} over the {@code system_metrics} table.
 */
public class JdbcMetricsStore implements MetricsStore {

    private static final String COLUMNS = "recorded_at, cpu_usage_pct, memory_usage_pct, disk_usage_pct, "
            + "network_bytes_in, network_bytes_out, connection_count, "
            + "load_average_1m, load_average_5m, load_average_15m";

    private static final RowMapper<MetricsSnapshot> SNAPSHOT_MAPPER = JdbcMetricsStore::mapSnapshot;

    private final JdbcTemplate jdbc;

    public JdbcMetricsStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void append(MetricsSnapshot snapshot) {
        MetricsSnapshot.LoadAverage load = snapshot.loadAverage();
        jdbc.update("INSERT INTO system_metrics (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                JdbcTimestamps.toDb(snapshot.timestamp()),
                snapshot.cpuUsagePct(),
                snapshot.memoryUsagePct(),
                snapshot.diskUsagePct(),
                snapshot.networkBytesIn(),
                snapshot.networkBytesOut(),
                snapshot.connectionCount(),
                load.oneMinute(),
                load.fiveMinutes(),
                load.fifteenMinutes());
    }

    @Override
    public Optional<MetricsSnapshot> latest() {
        List<MetricsSnapshot> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM system_metrics ORDER BY recorded_at DESC, id DESC LIMIT 1",
                SNAPSHOT_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<MetricAverages> averageSince(Instant since) {
        MetricAverages averages = jdbc.queryForObject(
                "SELECT AVG(cpu_usage_pct) AS cpu, AVG(memory_usage_pct) AS memory, AVG(disk_usage_pct) AS disk, "
                        + "AVG(CAST(network_bytes_in AS DOUBLE PRECISION)) AS net_in, "
                        + "AVG(CAST(network_bytes_out AS DOUBLE PRECISION)) AS net_out, "
                        + "AVG(CAST(connection_count AS DOUBLE PRECISION)) AS connections, COUNT(*) AS samples "
                        + "FROM system_metrics WHERE recorded_at >= ?",
                (rs, rowNum) -> new MetricAverages(
                        rs.getDouble("cpu"),
                        rs.getDouble("memory"),
                        rs.getDouble("disk"),
                        rs.getDouble("net_in"),
                        rs.getDouble("net_out"),
                        rs.getDouble("connections"),
                        rs.getLong("samples")),
                JdbcTimestamps.toDb(since));
        return averages == null || averages.samples() == 0 ? Optional.empty() : Optional.of(averages);
    }

    @Override
    public List<MetricsSnapshot> since(Instant since) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM system_metrics WHERE recorded_at >= ? ORDER BY recorded_at, id",
                SNAPSHOT_MAPPER,
                JdbcTimestamps.toDb(since));
    }

    private static MetricsSnapshot mapSnapshot(ResultSet rs, int rowNum) throws SQLException {
        return new MetricsSnapshot(
                JdbcTimestamps.fromDb(rs, "recorded_at"),
                rs.getDouble("cpu_usage_pct"),
                rs.getDouble("memory_usage_pct"),
                rs.getDouble("disk_usage_pct"),
                rs.getLong("network_bytes_in"),
                rs.getLong("network_bytes_out"),
                rs.getInt("connection_count"),
                new MetricsSnapshot.LoadAverage(
                        rs.getDouble("load_average_1m"),
                        rs.getDouble("load_average_5m"),
                        rs.getDouble("load_average_15m")));
    }
}
