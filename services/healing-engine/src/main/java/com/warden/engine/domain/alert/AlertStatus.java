package com.warden.engine.domain.alert;

public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED
}
