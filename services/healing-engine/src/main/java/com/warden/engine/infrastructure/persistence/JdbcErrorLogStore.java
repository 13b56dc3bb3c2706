package com.warden.engine.infrastructure.persistence;

import com.warden.engine.domain.metrics.ErrorLogEntry;
import com.warden.engine.domain.metrics.ErrorLogStore;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link ErrorLogStore} over the {@code error_logs} table. Messages are truncated to the column
 * width.
 */
public class JdbcErrorLogStore implements ErrorLogStore {

    static final int MAX_MESSAGE_LENGTH = 2000;

    private static final RowMapper<ErrorLogEntry> ROW_MAPPER = (rs, rowNum) -> new ErrorLogEntry(
            rs.getString("component"), rs.getString("message"), JdbcTimestamps.fromDb(rs, "recorded_at"));

    private final JdbcTemplate jdbc;

    public JdbcErrorLogStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void record(ErrorLogEntry entry) {
        String message = entry.message() == null ? "" : entry.message();
        if (message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }
        jdbc.update("INSERT INTO error_logs (component, message, recorded_at) VALUES (?, ?, ?)",
                entry.component(), message, JdbcTimestamps.toDb(entry.timestamp()));
    }

    @Override
    public List<ErrorLogEntry> since(Instant since) {
        return jdbc.query(
                "SELECT component, message, recorded_at FROM error_logs WHERE recorded_at >= ? ORDER BY recorded_at, id",
                ROW_MAPPER, JdbcTimestamps.toDb(since));
    }

    @Override
    public List<ErrorLogEntry> between(String component, Instant from, Instant to) {
        if (component == null) {
            return jdbc.query("SELECT component, message, recorded_at FROM error_logs"
                            + " WHERE recorded_at >= ? AND recorded_at <= ? ORDER BY recorded_at, id",
                    ROW_MAPPER, JdbcTimestamps.toDb(from), JdbcTimestamps.toDb(to));
        }
        return jdbc.query("SELECT component, message, recorded_at FROM error_logs"
                        + " WHERE component = ? AND recorded_at >= ? AND recorded_at <= ? ORDER BY recorded_at, id",
                ROW_MAPPER, component, JdbcTimestamps.toDb(from), JdbcTimestamps.toDb(to));
    }
}
