package com.surveillance.engine.controller;

import com.surveillance.engine.dto.DetectionRequest;
import com.surveillance.engine.entity.DetectionPattern;
import com.surveillance.engine.service.DetectionIngestService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * STOMP ingestion of detections for sensor gateways that keep a socket open.
 *
 * Message Flow:
 * 1. Gateway sends a detection to /app/detections
 * 2. Payload is validated and stored
 * 3. Sender gets an ack on /user/queue/reply, or the reason on /user/queue/errors
 * 4. Alerts raised by the detection arrive on /topic/alerts
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class DetectionStreamingController {

    private final DetectionIngestService detectionIngestService;
    private final SimpMessagingTemplate messagingTemplate;
    private final Validator validator;
    private final Clock clock;

    @MessageMapping("/detections")
    public void handleDetection(@Payload DetectionRequest request, @Nullable Principal principal) {
        Set<ConstraintViolation<DetectionRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String error = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.warn("Rejected streamed detection: {}", error);
            reply(principal, "/queue/errors", Map.of(
                    "status", "ERROR",
                    "error", error,
                    "timestamp", clock.instant().toString()
            ));
            return;
        }

        try {
            DetectionPattern saved = detectionIngestService.ingest(request);
            reply(principal, "/queue/reply", Map.of(
                    "status", "OK",
                    "id", saved.getId(),
                    "timestamp", clock.instant().toString()
            ));
        } catch (RuntimeException e) {
            log.error("Error storing streamed detection: {}", e.getMessage(), e);
            reply(principal, "/queue/errors", Map.of(
                    "status", "ERROR",
                    "error", "Failed to store detection",
                    "timestamp", clock.instant().toString()
            ));
        }
    }

    private void reply(Principal principal, String destination, Map<String, Object> body) {
        if (principal != null) {
            messagingTemplate.convertAndSendToUser(principal.getName(), destination, body);
        }
    }
}
