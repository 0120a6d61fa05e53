package com.surveillance.engine.controller;

import com.surveillance.engine.dto.ManualTriggerRequest;
import com.surveillance.engine.dto.TriggerResponse;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.service.TrainingTriggerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/training")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Training", description = "Manual retraining requests")
public class TrainingController {

    private final TrainingTriggerService trainingTriggerService;

    /**
     * Forces a retraining request regardless of counter state.
     *
     * Example request:
     * POST /api/training/trigger
     * {"modelType": "habitat_predictor", "force": true}
     */
    @Operation(
            summary = "Trigger model training",
            description = "Creates a pending training trigger. `force` requests a full retrain; " +
                    "`modelType` defaults to \"all\". The retraining counters are not touched."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Trigger created",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = "{\"success\":true,\"message\":\"Training triggered for habitat_predictor\",\"triggerId\":\"5b1f...\"}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "Malformed body"),
            @ApiResponse(responseCode = "500", description = "Trigger could not be stored")
    })
    @PostMapping("/trigger")
    public ResponseEntity<TriggerResponse> trigger(@RequestBody(required = false) ManualTriggerRequest request) {
        TrainingTrigger trigger = trainingTriggerService.triggerManually(request);

        return ResponseEntity.ok(new TriggerResponse(
                true,
                "Training triggered for " + trigger.getModelType(),
                trigger.getId()
        ));
    }
}
