package com.warden.engine.domain.alert;

import java.util.List;

/**
 * A page of alerts plus the count of all active alerts, independent of the filter.
 */
public record AlertPage(long totalActive, List<Alert> alerts) {

    public AlertPage {
        alerts = List.copyOf(alerts);
    }
}
