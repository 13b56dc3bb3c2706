package com.warden.engine.domain.alert;

/**
 * Query over stored alerts. Null status or severity matches any value.
 *
 * @param limit maximum number of alerts returned; values below 1 mean {@value #DEFAULT_LIMIT},
 *     values above {@value #MAX_LIMIT} are capped
 */
public record AlertFilter(AlertStatus status, AlertSeverity severity, int limit) {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public AlertFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static AlertFilter all() {
        return new AlertFilter(null, null, DEFAULT_LIMIT);
    }

    public static AlertFilter active() {
        return new AlertFilter(AlertStatus.ACTIVE, null, DEFAULT_LIMIT);
    }
}
