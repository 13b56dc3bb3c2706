package com.warden.database.migration;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the engine's own schema.
 *
 * <p>Bound from {@code warden.flyway}:
 *
 * <pre>{@code
 * warden:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration/warden
 *     baseline-on-migrate: true
 * }</pre>
 *
 * @param enabled whether migrations run on startup (default true)
 * @param locations Flyway migration locations (default {@code classpath:db/migration/warden})
 * @param baselineOnMigrate baseline an existing non-empty schema instead of failing
 * @param table name of the Flyway history table (default {@code warden_schema_history})
 */
@Validated
@ConfigurationProperties(prefix = "warden.flyway")
public record WardenFlywayProperties(
        Boolean enabled, @NotEmpty List<String> locations, Boolean baselineOnMigrate, String table) {

    public static final String DEFAULT_LOCATION = "classpath:db/migration/warden";

    public static final String DEFAULT_TABLE = "warden_schema_history";

    public WardenFlywayProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (locations == null || locations.isEmpty()) {
            locations = List.of(DEFAULT_LOCATION);
        } else {
            locations = List.copyOf(locations);
        }
        if (baselineOnMigrate == null) {
            baselineOnMigrate = Boolean.TRUE;
        }
        if (table == null || table.isBlank()) {
            table = DEFAULT_TABLE;
        }
    }

    /** Defaults for every field. */
    public static WardenFlywayProperties defaults() {
        return new WardenFlywayProperties(null, null, null, null);
    }
}
