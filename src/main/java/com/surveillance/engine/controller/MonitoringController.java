package com.surveillance.engine.controller;

import com.surveillance.engine.dto.AnalyticsReport;
import com.surveillance.engine.entity.OutbreakAlert;
import com.surveillance.engine.entity.SystemStatus;
import com.surveillance.engine.service.AnalyticsService;
import com.surveillance.engine.service.SystemHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read views consumed by the dashboard: health, analytics, alerts and counters.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Monitoring", description = "Health and analytics read views")
public class MonitoringController {

    private final SystemHealthService systemHealthService;
    private final AnalyticsService analyticsService;

    /**
     * Writes a heartbeat and reports liveness. Always answers with JSON, 500 when the
     * store is unreachable or no transaction could be opened.
     */
    @Operation(summary = "System health check", description = "Records a heartbeat in system_status and reports liveness.")
    @GetMapping("/system/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            SystemStatus heartbeat = systemHealthService.recordHeartbeat();
            return ResponseEntity.ok(Map.of(
                    "status", "healthy",
                    "timestamp", heartbeat.getLastCheck().toString(),
                    "project", heartbeat.getProjectId(),
                    "functions", heartbeat.getStatus()
            ));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "status", "unhealthy",
                    "error", String.valueOf(e.getMessage())
            ));
        }
    }

    @Operation(
            summary = "Detection analytics",
            description = "Detections in the last 30 days, active alerts and the 10 newest training triggers."
    )
    @GetMapping("/analytics")
    public ResponseEntity<AnalyticsReport> analytics() {
        return ResponseEntity.ok(analyticsService.getAnalytics());
    }

    @Operation(summary = "Active outbreak alerts", description = "Newest first.")
    @GetMapping("/alerts")
    public ResponseEntity<List<OutbreakAlert>> activeAlerts() {
        return ResponseEntity.ok(analyticsService.getActiveAlerts());
    }

    @Operation(summary = "Retraining counter for a model")
    @GetMapping("/models/{modelType}")
    public ResponseEntity<?> modelMeta(
            @Parameter(description = "Model type", example = "habitat_predictor") @PathVariable("modelType") String modelType) {
        return analyticsService.getModelMeta(modelType)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "success", false,
                        "error", "No training metadata for model " + modelType
                )));
    }
}
