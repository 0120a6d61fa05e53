package com.surveillance.engine.controller;

import com.surveillance.engine.dto.DetectionRequest;
import com.surveillance.engine.entity.DetectionPattern;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.service.DetectionIngestService;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.security.Principal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionStreamingControllerTest {

    private static final Principal GATEWAY = () -> "gateway-7";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private DetectionIngestService detectionIngestService;

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private ValidatorFactory validatorFactory;
    private DetectionStreamingController controller;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        Validator validator = validatorFactory.getValidator();
        controller = new DetectionStreamingController(detectionIngestService, messagingTemplate, validator,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldAcknowledgeStoredDetection() {
        when(detectionIngestService.ingest(any())).thenReturn(DetectionPattern.builder().id("det-1").build());

        controller.handleDetection(request(45.5, 0.9), GATEWAY);

        ArgumentCaptor<Object> reply = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSendToUser(eq("gateway-7"), eq("/queue/reply"), reply.capture());
        assertThat((Map<String, Object>) reply.getValue())
                .containsEntry("status", "OK")
                .containsEntry("id", "det-1")
                .containsEntry("timestamp", "2024-05-01T12:00:00Z");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReportValidationErrorsWithoutStoring() {
        controller.handleDetection(request(120.0, 0.9), GATEWAY);

        ArgumentCaptor<Object> reply = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSendToUser(eq("gateway-7"), eq("/queue/errors"), reply.capture());
        assertThat((Map<String, Object>) reply.getValue())
                .containsEntry("status", "ERROR")
                .containsEntry("error", "latitude: Latitude must be <= 90")
                .containsEntry("timestamp", "2024-05-01T12:00:00Z");
        verifyNoInteractions(detectionIngestService);
    }

    @Test
    void shouldReportStorageFailure() {
        when(detectionIngestService.ingest(any())).thenThrow(new StorageException("connection refused"));

        controller.handleDetection(request(45.5, 0.9), GATEWAY);

        verify(messagingTemplate).convertAndSendToUser(eq("gateway-7"), eq("/queue/errors"), any(Object.class));
    }

    @Test
    void shouldStoreAnonymousDetectionWithoutReply() {
        when(detectionIngestService.ingest(any())).thenReturn(DetectionPattern.builder().id("det-2").build());

        controller.handleDetection(request(45.5, 0.9), null);

        verify(detectionIngestService).ingest(any());
        verifyNoInteractions(messagingTemplate);
    }

    private static DetectionRequest request(double latitude, double confidence) {
        return new DetectionRequest(latitude, -122.5, "aedes", confidence, null, null, null);
    }
}
