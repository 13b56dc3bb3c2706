package com.warden.engine;

import com.warden.database.migration.WardenFlywayConfig;
import com.warden.engine.config.DetectionProperties;
import com.warden.engine.config.NotificationProperties;
import com.warden.engine.config.ProbeProperties;
import com.warden.engine.config.QueueProperties;
import com.warden.engine.config.RemediationProperties;
import com.warden.engine.config.SchedulerProperties;
import com.warden.engine.config.ServiceProperties;
import com.warden.engine.config.StorageProperties;
import com.warden.engine.config.ThresholdProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Warden healing engine: probes component health, aggregates metrics, detects anomalies and runs
 * automated recovery with escalation.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Engine schema migrations through {@link WardenFlywayConfig}
 *   <li>Proactive monitoring lanes (disable with {@code warden.scheduler.enabled=false})
 * </ul>
 */
@SpringBootApplication
@Import(WardenFlywayConfig.class)
@EnableConfigurationProperties({
    ServiceProperties.class,
    ThresholdProperties.class,
    ProbeProperties.class,
    DetectionProperties.class,
    RemediationProperties.class,
    SchedulerProperties.class,
    NotificationProperties.class,
    StorageProperties.class,
    QueueProperties.class
})
public class WardenEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(WardenEngineApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WardenEngineApplication.class, args);
        log.info("Warden healing engine started");
    }
}
