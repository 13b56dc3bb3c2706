package com.warden.engine.domain.alert;

public enum AlertCategory {
    SYSTEM,
    PERFORMANCE,
    QUEUE,
    RECOVERY,
    ANOMALY
}
