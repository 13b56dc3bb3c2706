package com.warden.engine.domain.alert;

/**
 * Alert and notification severity, in ascending order.
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
