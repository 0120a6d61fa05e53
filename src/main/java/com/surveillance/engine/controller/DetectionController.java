package com.surveillance.engine.controller;

import com.surveillance.engine.dto.DetectionRequest;
import com.surveillance.engine.entity.DetectionPattern;
import com.surveillance.engine.service.DetectionIngestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST ingestion of detections. Each stored detection is processed asynchronously.
 */
@RestController
@RequestMapping("/api/detections")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Detections", description = "Detection ingestion")
public class DetectionController {

    private final DetectionIngestService detectionIngestService;

    @Operation(
            summary = "Ingest a detection",
            description = "Stores the detection and schedules anomaly evaluation and counter update for it."
    )
    @PostMapping
    public ResponseEntity<Map<String, Object>> ingest(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Detection with coordinates, species and confidence",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = DetectionRequest.class),
                            examples = @ExampleObject(
                                    value = "{\"latitude\":45.5231,\"longitude\":-122.6765,\"species\":\"aedes_aegypti\",\"confidenceScore\":0.92}"
                            )
                    )
            )
            @Valid @RequestBody DetectionRequest request) {
        DetectionPattern saved = detectionIngestService.ingest(request);
        log.info("Accepted detection {} at {}, {}", saved.getId(), saved.getLatitude(), saved.getLongitude());

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "id", saved.getId(),
                "detectionTimestamp", saved.getDetectionTimestamp().toString()
        ));
    }
}
