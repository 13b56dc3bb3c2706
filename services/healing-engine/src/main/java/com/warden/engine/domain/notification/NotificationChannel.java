package com.warden.engine.domain.notification;

/**
 * Outbound channel to administrators.
 */
public interface NotificationChannel {

    /**
     * Delivers {@code notification}.
     *
     * @throws NotificationException if delivery fails
     */
    void send(Notification notification);
}
