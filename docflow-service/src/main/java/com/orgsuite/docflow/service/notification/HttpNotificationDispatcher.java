package com.orgsuite.docflow.service.notification;

import com.orgsuite.docflow.config.DocflowProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts notifications to the delivery service as JSON
 * ({@code recipients, email, template, documentId, data}).
 * With no endpoint configured, notifications are only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpNotificationDispatcher implements NotificationDispatcher {

    private final RestTemplate restTemplate;
    private final DocflowProperties properties;

    @Override
    @CircuitBreaker(name = "notification", fallbackMethod = "dispatchFallback")
    public void dispatch(Notification notification) {
        if (!notification.hasRecipients()) {
            log.debug("Skipping {} for document {}: no recipients", notification.kind(), notification.documentId());
            return;
        }

        String endpoint = properties.getNotification().getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            log.info("Notification {} for document {} ({} recipient(s)) not sent: no endpoint configured",
                    notification.kind(), notification.documentId(), notification.recipientUserIds().size());
            return;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipients", notification.recipientUserIds());
        body.put("email", notification.recipientEmail());
        body.put("template", notification.kind().name());
        body.put("documentId", notification.documentId());
        body.put("data", notification.payload());

        restTemplate.postForEntity(endpoint, body, Void.class);
        log.info("Notification {} dispatched for document {}", notification.kind(), notification.documentId());
    }

    private void dispatchFallback(Notification notification, Throwable t) {
        log.error("Notification {} for document {} dropped (circuit breaker): {}",
                notification.kind(), notification.documentId(), t.getMessage());
    }
}
