package com.warden.engine.infrastructure.notification;

import com.warden.engine.domain.alert.AlertSeverity;
import com.warden.engine.domain.notification.Notification;
import com.warden.engine.domain.notification.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log. Used when no webhook is configured.
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    @Override
    public void send(Notification notification) {
        if (notification.severity().compareTo(AlertSeverity.ERROR) >= 0) {
            log.error("[{}] {} {}", notification.severity(), notification.subject(), notification.payload());
        } else {
            log.info("[{}] {} {}", notification.severity(), notification.subject(), notification.payload());
        }
    }
}
