package com.warden.engine.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.warden.engine.domain.alert.Alert;
import com.warden.engine.domain.alert.AlertCategory;
import com.warden.engine.domain.alert.AlertFilter;
import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.alert.AlertStatus;
import com.warden.engine.domain.alert.AlertStore;
import com.warden.engine.infrastructure.json.JsonCodec;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link AlertStore} over the {@code system_alerts} table. Details are stored as JSON.
 */
public class JdbcAlertStore implements AlertStore {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS = "id, severity, category, title, message, details, source, status, "
            + "component, created_at, resolved_by, resolution_message, resolved_at";

    private static final RowMapper<Alert> ALERT_MAPPER = JdbcAlertStore::mapAlert;

    private final JdbcTemplate jdbc;

    public JdbcAlertStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Alert alert) {
        jdbc.update("INSERT INTO system_alerts (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                alert.id(),
                alert.severity().name(),
                alert.category().name(),
                alert.title(),
                alert.message(),
                JsonCodec.write(alert.details()),
                alert.source(),
                alert.status().name(),
                alert.component(),
                JdbcTimestamps.toDb(alert.timestamp()),
                alert.resolvedBy(),
                alert.resolutionMessage(),
                JdbcTimestamps.toDb(alert.resolvedAt()));
    }

    @Override
    public Optional<Alert> findById(String id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM system_alerts WHERE id = ?", ALERT_MAPPER, id)
                .stream()
                .findFirst();
    }

    @Override
    public List<Alert> find(AlertFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM system_alerts WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (filter.status() != null) {
            sql.append(" AND status = ?");
            args.add(filter.status().name());
        }
        if (filter.severity() != null) {
            sql.append(" AND severity = ?");
            args.add(filter.severity().name());
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");
        args.add(filter.limit());
        return jdbc.query(sql.toString(), ALERT_MAPPER, args.toArray());
    }

    @Override
    public long countActive() {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM system_alerts WHERE status = ?", Long.class, AlertStatus.ACTIVE.name());
        return count == null ? 0 : count;
    }

    @Override
    public Map<AlertSeverity, Long> countActiveBySeverity() {
        Map<AlertSeverity, Long> counts = new EnumMap<>(AlertSeverity.class);
        jdbc.query("SELECT severity, COUNT(*) AS total FROM system_alerts WHERE status = ? GROUP BY severity",
                (RowCallbackHandler) rs -> counts.put(
                        AlertSeverity.valueOf(rs.getString("severity")), rs.getLong("total")),
                AlertStatus.ACTIVE.name());
        return counts;
    }

    @Override
    public void update(Alert alert) {
        jdbc.update("UPDATE system_alerts SET status = ?, resolved_by = ?, resolution_message = ?, resolved_at = ? "
                        + "WHERE id = ?",
                alert.status().name(),
                alert.resolvedBy(),
                alert.resolutionMessage(),
                JdbcTimestamps.toDb(alert.resolvedAt()),
                alert.id());
    }

    private static Alert mapAlert(ResultSet rs, int rowNum) throws SQLException {
        String details = rs.getString("details");
        return new Alert(
                rs.getString("id"),
                AlertSeverity.valueOf(rs.getString("severity")),
                AlertCategory.valueOf(rs.getString("category")),
                rs.getString("title"),
                rs.getString("message"),
                details == null ? Map.of() : JsonCodec.read(details, DETAILS_TYPE),
                rs.getString("source"),
                AlertStatus.valueOf(rs.getString("status")),
                rs.getString("component"),
                JdbcTimestamps.fromDb(rs, "created_at"),
                rs.getString("resolved_by"),
                rs.getString("resolution_message"),
                JdbcTimestamps.fromDb(rs, "resolved_at"));
    }
}
