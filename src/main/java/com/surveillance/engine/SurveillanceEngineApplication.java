package com.surveillance.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Anomaly detection and retraining-trigger engine.
 *
 * Flow:
 * 1. Detections arrive via REST or WebSocket and are stored
 * 2. After commit, each detection is handed to the DetectionEventHandler asynchronously
 * 3. The AnomalyEvaluator windows recent nearby detections and may raise an outbreak alert
 * 4. The RetrainingCounter advances per-model counters and may queue a training trigger
 * 5. Health and analytics endpoints read the resulting state back
 */
@SpringBootApplication
@EnableAsync
public class SurveillanceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveillanceEngineApplication.class, args);
    }
}
