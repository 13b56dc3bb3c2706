package com.warden.engine.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.warden.engine.domain.recovery.RecoveryAttempt;
import com.warden.engine.domain.recovery.RecoveryAuditSink;
import com.warden.engine.infrastructure.json.JsonCodec;
import com.warden.observability.HealthReport;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link RecoveryAuditSink} over the {@code recovery_audit} table. The trigger report and the
 * actions are stored as JSON.
 */
public class JdbcRecoveryAuditSink implements RecoveryAuditSink {

    private static final TypeReference<List<String>> ACTIONS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;

    public JdbcRecoveryAuditSink(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void record(RecoveryAttempt attempt) {
        jdbc.update("INSERT INTO recovery_audit "
                        + "(trigger_status, trigger_report, actions, outcome, success, attempted_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?)",
                attempt.trigger().status().name(),
                JsonCodec.write(attempt.trigger()),
                JsonCodec.write(attempt.actions()),
                attempt.outcome(),
                attempt.success(),
                JdbcTimestamps.toDb(attempt.attemptedAt()));
    }

    @Override
    public List<RecoveryAttempt> since(Instant since) {
        return jdbc.query(
                "SELECT trigger_report, actions, outcome, success, attempted_at FROM recovery_audit "
                        + "WHERE attempted_at >= ? ORDER BY attempted_at DESC, id DESC",
                (rs, rowNum) -> new RecoveryAttempt(
                        JsonCodec.read(rs.getString("trigger_report"), HealthReport.class),
                        JsonCodec.read(rs.getString("actions"), ACTIONS_TYPE),
                        rs.getBoolean("success"),
                        rs.getString("outcome"),
                        JdbcTimestamps.fromDb(rs, "attempted_at")),
                JdbcTimestamps.toDb(since));
    }
}
