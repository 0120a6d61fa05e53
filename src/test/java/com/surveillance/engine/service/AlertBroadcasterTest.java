package com.surveillance.engine.service;

import com.surveillance.engine.entity.AlertMetadata;
import com.surveillance.engine.entity.AlertType;
import com.surveillance.engine.entity.OutbreakAlert;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AlertBroadcasterTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @InjectMocks
    private AlertBroadcaster broadcaster;

    @Test
    @SuppressWarnings("unchecked")
    void shouldPublishAlertToTopic() {
        broadcaster.publish(alert());

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(AlertBroadcaster.ALERTS_TOPIC), payload.capture());
        Map<String, Object> message = (Map<String, Object>) payload.getValue();
        assertThat(message)
            .containsEntry("type", "OUTBREAK_ALERT")
            .containsEntry("alertId", "alert-1")
            .containsEntry("severityLevel", 3)
            .containsEntry("timestamp", "2024-05-01T12:00:00Z");
    }

    @Test
    void shouldSwallowBrokerFailureAfterLogging() {
        doThrow(new MessageDeliveryException("no broker"))
            .when(messagingTemplate).convertAndSend(eq(AlertBroadcaster.ALERTS_TOPIC), any(Object.class));

        assertThatCode(() -> broadcaster.publish(alert())).doesNotThrowAnyException();
    }

    private static OutbreakAlert alert() {
        return OutbreakAlert.builder()
            .id("alert-1")
            .alertType(AlertType.POPULATION_SPIKE)
            .severityLevel(3)
            .latitude(45.5)
            .longitude(-122.5)
            .radiusKm(10.0)
            .description("Potential population spike detected with 5 observations")
            .alertTimestamp(Instant.parse("2024-05-01T12:00:00Z"))
            .metadata(new AlertMetadata(5, 0.9, "d-5"))
            .build();
    }
}
