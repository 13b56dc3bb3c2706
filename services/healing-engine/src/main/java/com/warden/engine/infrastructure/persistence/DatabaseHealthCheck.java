package com.warden.engine.infrastructure.persistence;

import com.warden.observability.ComponentHealth;
import com.warden.observability.TimedHealthCheck;
import java.sql.ResultSet;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;

/**
 * Relational store probe: {@code SELECT 1} under a statement timeout, so a hung database
 * releases the probe thread instead of keeping it forever.
 */
public class DatabaseHealthCheck extends TimedHealthCheck {

    public static final String NAME = "database";
    static final String PROBE_QUERY = "SELECT 1";

    private final JdbcTemplate jdbc;
    private final int queryTimeoutSeconds;

    public DatabaseHealthCheck(JdbcTemplate jdbc, Duration queryTimeout, Executor executor) {
        super(NAME, executor);
        this.jdbc = jdbc;
        // JDBC timeouts have whole-second granularity; 0 would mean no limit.
        this.queryTimeoutSeconds = (int) Math.max(1, (queryTimeout.toMillis() + 999) / 1000);
    }

    @Override
    protected ComponentHealth probe(long startNanos) {
        Integer one = jdbc.execute((StatementCallback<Integer>) statement -> {
            statement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rows = statement.executeQuery(PROBE_QUERY)) {
                return rows.next() ? rows.getInt(1) : null;
            }
        });
        if (one == null || one != 1) {
            return ComponentHealth.unhealthy(NAME, "Unexpected probe result: " + one, elapsedMs(startNanos));
        }
        return ComponentHealth.healthy(NAME, elapsedMs(startNanos));
    }

    int queryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }
}
