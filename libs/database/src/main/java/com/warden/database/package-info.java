/**
 * Schema migrations for the Warden engine.
 *
 * <p>Migration scripts live under {@code db/migration/warden} and follow Flyway's {@code
 * V{n}__{desc}.sql} naming. They are written for PostgreSQL and kept within the subset that H2's
 * PostgreSQL compatibility mode also accepts, so the same scripts run in tests.
 *
 * @see com.warden.database.migration.WardenFlywayConfig
 */
package com.warden.database;
