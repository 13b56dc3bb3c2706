package com.warden.engine.config;

import com.warden.engine.domain.notification.NotificationChannel;
import com.warden.engine.infrastructure.notification.LoggingNotificationChannel;
import com.warden.engine.infrastructure.notification.WebhookNotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationConfig {

    private static final Logger log = LoggerFactory.getLogger(NotificationConfig.class);

    /** Webhook channel when a URL is configured, otherwise the log. */
    @Bean
    public NotificationChannel notificationChannel(NotificationProperties properties, RestTemplateBuilder builder) {
        if (!properties.webhookConfigured()) {
            log.info("No notification webhook configured, notifications will be logged");
            return new LoggingNotificationChannel();
        }
        return new WebhookNotificationChannel(
                builder.setConnectTimeout(properties.connectTimeout())
                        .setReadTimeout(properties.readTimeout())
                        .build(),
                properties.webhookUrl());
    }
}
