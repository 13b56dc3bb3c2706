package com.warden.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the metrics, alert and recovery audit tables.
 *
 * <p>Runs against the application's primary {@link DataSource} with its own history table, so
 * the engine's schema can live alongside other schemas in a shared database. Services using this
 * module disable Spring Boot's Flyway auto-configuration:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see WardenFlywayProperties
 */
@Configuration
@EnableConfigurationProperties(WardenFlywayProperties.class)
@ConditionalOnProperty(prefix = "warden.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WardenFlywayConfig {

    /** Bean name for the engine schema Flyway instance. */
    public static final String WARDEN_FLYWAY_BEAN = "wardenFlyway";

    private static final Logger log = LoggerFactory.getLogger(WardenFlywayConfig.class);

    /**
     * Creates the Flyway instance and migrates the schema during bean initialization.
     *
     * @param dataSource primary application data source
     * @param properties externalized Flyway configuration
     * @return configured Flyway instance
     */
    @Bean(name = WARDEN_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway wardenFlyway(DataSource dataSource, WardenFlywayProperties properties) {
        log.info("Configuring schema migrations from {}", properties.locations());
        return createFlyway(dataSource, properties);
    }

    /**
     * Builds a Flyway instance without running it. Clean is always disabled.
     */
    public static Flyway createFlyway(DataSource dataSource, WardenFlywayProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().toArray(String[]::new))
                .table(properties.table())
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
