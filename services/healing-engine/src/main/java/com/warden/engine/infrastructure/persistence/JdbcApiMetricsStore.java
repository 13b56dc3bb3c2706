package com.warden.engine.infrastructure.persistence;

import com.warden.engine.domain.metrics.ApiCall;
import com.warden.engine.domain.metrics.ApiMetricsStore;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link ApiMetricsStore} over the {@code api_metrics} table.
 */
public class JdbcApiMetricsStore implements ApiMetricsStore {

    static final int MAX_PATH_LENGTH = 512;

    private final JdbcTemplate jdbc;

    public JdbcApiMetricsStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void record(ApiCall call) {
        String path = call.path().length() > MAX_PATH_LENGTH ? call.path().substring(0, MAX_PATH_LENGTH) : call.path();
        jdbc.update("INSERT INTO api_metrics (path, method, status_code, response_time_ms, recorded_at) "
                        + "VALUES (?, ?, ?, ?, ?)",
                path, call.method(), call.statusCode(), call.responseTimeMs(), JdbcTimestamps.toDb(call.timestamp()));
    }

    @Override
    public List<ApiCall> since(Instant since) {
        return jdbc.query(
                "SELECT path, method, status_code, response_time_ms, recorded_at FROM api_metrics "
                        + "WHERE recorded_at >= ? ORDER BY recorded_at, id",
                (rs, rowNum) -> new ApiCall(
                        rs.getString("path"),
                        rs.getString("method"),
                        rs.getInt("status_code"),
                        rs.getLong("response_time_ms"),
                        JdbcTimestamps.fromDb(rs, "recorded_at")),
                JdbcTimestamps.toDb(since));
    }
}
