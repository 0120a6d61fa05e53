package com.surveillance.engine.service;

import com.surveillance.engine.entity.OutbreakAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Pushes newly created outbreak alerts to {@code /topic/alerts}.
 *
 * The alert is already durable when this runs, so a failed push is logged and dropped;
 * dashboards catch up from the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertBroadcaster {

    static final String ALERTS_TOPIC = "/topic/alerts";

    private final SimpMessagingTemplate messagingTemplate;

    public void publish(OutbreakAlert alert) {
        Map<String, Object> message = new HashMap<>();
        message.put("type", "OUTBREAK_ALERT");
        message.put("alertId", alert.getId());
        message.put("alertType", alert.getAlertType());
        message.put("severityLevel", alert.getSeverityLevel());
        message.put("latitude", alert.getLatitude());
        message.put("longitude", alert.getLongitude());
        message.put("radiusKm", alert.getRadiusKm());
        message.put("description", alert.getDescription());
        message.put("metadata", alert.getMetadata());
        message.put("timestamp", String.valueOf(alert.getAlertTimestamp()));

        try {
            messagingTemplate.convertAndSend(ALERTS_TOPIC, message);
        } catch (MessagingException e) {
            log.warn("Failed to broadcast outbreak alert {}: {}", alert.getId(), e.getMessage());
        }
    }
}
