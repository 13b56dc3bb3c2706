package com.warden.engine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Administrator notification channel, bound from {@code warden.notification.*}.
 *
 * <p>When {@code webhook-url} is blank, notifications are written to the log instead.
 *
 * @param webhookUrl endpoint receiving JSON notifications.
 * @param connectTimeout connect timeout for webhook calls (default 5s).
 * @param readTimeout read timeout for webhook calls (default 10s).
 */
@ConfigurationProperties(prefix = "warden.notification")
public record NotificationProperties(String webhookUrl, Duration connectTimeout, Duration readTimeout) {

    public NotificationProperties {
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(10);
        }
    }

    public boolean webhookConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
