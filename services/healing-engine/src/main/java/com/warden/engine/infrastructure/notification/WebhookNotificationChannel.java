package com.warden.engine.infrastructure.notification;

import com.warden.engine.domain.notification.Notification;
import com.warden.engine.domain.notification.NotificationChannel;
import com.warden.engine.domain.notification.NotificationException;
import com.warden.observability.CorrelationContextHolder;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts notifications as JSON to an administrator webhook. The current correlation id, if any, is
 * forwarded in the {@code X-Correlation-ID} header.
 */
public class WebhookNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final RestTemplate restTemplate;
    private final String webhookUrl;

    public WebhookNotificationChannel(RestTemplate restTemplate, String webhookUrl) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public void send(Notification notification) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("subject", notification.subject());
        body.put("severity", notification.severity().name());
        body.put("createdAt", notification.createdAt().toString());
        body.put("payload", notification.payload());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String correlationId = CorrelationContextHolder.currentCorrelationId();
        if (correlationId != null) {
            headers.set(CORRELATION_ID_HEADER, correlationId);
        }

        try {
            restTemplate.postForEntity(webhookUrl, new HttpEntity<>(body, headers), Void.class);
            log.info("Notification sent: {}", notification.subject());
        } catch (RestClientException e) {
            throw new NotificationException("Failed to deliver notification '" + notification.subject() + "'", e);
        }
    }
}
