package com.warden.engine.domain.notification;

/**
 * Delivery of a notification failed.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
