package com.warden.engine.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.warden.observability.ComponentHealth;
import com.warden.observability.HealthStatus;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;

@DisplayName("DatabaseHealthCheck")
class DatabaseHealthCheckTest {

    private static final Duration TIMEOUT = Duration.ofMillis(5000);

    @Test
    @DisplayName("should be healthy when the database answers")
    void shouldBeHealthy() {
        DatabaseHealthCheck check = new DatabaseHealthCheck(MigratedDatabase.create(), TIMEOUT, Runnable::run);

        ComponentHealth health = check.check().join();

        assertThat(health.name()).isEqualTo("database");
        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("should be unhealthy when the query fails")
    @SuppressWarnings("unchecked")
    void shouldBeUnhealthyOnFailure() {
        JdbcTemplate jdbc = mock(JdbcTemplate.class);
        when(jdbc.execute(any(StatementCallback.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ComponentHealth health = new DatabaseHealthCheck(jdbc, TIMEOUT, Runnable::run).check().join();

        assertThat(health.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(health.error()).contains("connection refused");
    }

    @Test
    @DisplayName("should put the health-check timeout on the statement")
    @SuppressWarnings("unchecked")
    void shouldBoundTheStatement() throws Exception {
        JdbcTemplate jdbc = mock(JdbcTemplate.class);
        Statement statement = mock(Statement.class);
        ResultSet rows = mock(ResultSet.class);
        when(statement.executeQuery(DatabaseHealthCheck.PROBE_QUERY)).thenReturn(rows);
        when(rows.next()).thenReturn(true);
        when(rows.getInt(1)).thenReturn(1);
        ArgumentCaptor<StatementCallback<Integer>> callback = ArgumentCaptor.forClass(StatementCallback.class);
        when(jdbc.execute(callback.capture())).thenAnswer(call -> callback.getValue().doInStatement(statement));

        ComponentHealth health = new DatabaseHealthCheck(jdbc, Duration.ofMillis(2500), Runnable::run).run();

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        verify(statement).setQueryTimeout(3);
    }

    @Test
    @DisplayName("should never use an unlimited statement timeout")
    void shouldNeverUseUnlimitedTimeout() {
        var check = new DatabaseHealthCheck(mock(JdbcTemplate.class), Duration.ofMillis(200), Runnable::run);

        assertThat(check.queryTimeoutSeconds()).isEqualTo(1);
    }
}
