package com.warden.engine.config;

import com.warden.engine.domain.alert.AlertStore;
import com.warden.engine.domain.metrics.ApiMetricsStore;
import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.engine.domain.metrics.MetricsStore;
import com.warden.engine.domain.recovery.RecoveryAuditSink;
import com.warden.engine.infrastructure.persistence.JdbcAlertStore;
import com.warden.engine.infrastructure.persistence.JdbcApiMetricsStore;
import com.warden.engine.infrastructure.persistence.JdbcErrorLogStore;
import com.warden.engine.infrastructure.persistence.JdbcMetricsStore;
import com.warden.engine.infrastructure.persistence.JdbcRecoveryAuditSink;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * JDBC stores over the schema migrated by the database module.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public MetricsStore metricsStore(JdbcTemplate jdbc) {
        return new JdbcMetricsStore(jdbc);
    }

    @Bean
    public ApiMetricsStore apiMetricsStore(JdbcTemplate jdbc) {
        return new JdbcApiMetricsStore(jdbc);
    }

    @Bean
    public ErrorLogStore errorLogStore(JdbcTemplate jdbc) {
        return new JdbcErrorLogStore(jdbc);
    }

    @Bean
    public AlertStore alertStore(JdbcTemplate jdbc) {
        return new JdbcAlertStore(jdbc);
    }

    @Bean
    public RecoveryAuditSink recoveryAuditSink(JdbcTemplate jdbc) {
        return new JdbcRecoveryAuditSink(jdbc);
    }
}
