package com.surveillance.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable policy knobs of the detection engine, bound from {@code surveillance.*}.
 *
 * The anomaly window and thresholds are the whole detection-sensitivity trade-off:
 * widening the window or lowering either threshold raises recall at the cost of
 * more alerts. Defaults reproduce the production policy.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "surveillance")
public class SurveillanceProperties {

    // Reported by the health heartbeat
    private String projectId = "field-surveillance";

    private Anomaly anomaly = new Anomaly();

    private Retraining retraining = new Retraining();

    private Processing processing = new Processing();

    private DeliveryGuard deliveryGuard = new DeliveryGuard();

    private Analytics analytics = new Analytics();

    @Data
    public static class Anomaly {
        // How far back candidate detections are considered
        private Duration lookback = Duration.ofDays(7);

        // Half side of the square search window, in degrees on both axes
        private double windowDegrees = 0.1;

        // Cluster cardinality needed before confidence is even looked at
        private int minDetections = 5;

        // Mean confidence must be strictly above this
        private double minAvgConfidence = 0.7;

        private int severityLevel = 3;

        private double radiusKm = 10.0;

        // Off reproduces one alert per qualifying detection
        private boolean suppressDuplicates = false;

        // Only consulted when suppressDuplicates is on
        private Duration duplicateWindow = Duration.ofHours(24);
    }

    @Data
    public static class Retraining {
        private int threshold = 10;

        // Every processed detection feeds each of these counters
        private List<String> modelTypes = new ArrayList<>(List.of("habitat_predictor"));

        private String initialVersion = "1.0.0";

        // Refused counter updates are retried this often before surfacing as a storage failure
        private int maxAttempts = 20;

        // First retry wait; doubles per attempt with +-50% jitter
        private Duration backoff = Duration.ofMillis(25);

        private Duration maxBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Processing {
        // Upper bound on the store time one detection may consume
        private Duration deadline = Duration.ofSeconds(30);

        private int workerThreads = 8;
    }

    @Data
    public static class DeliveryGuard {
        private boolean enabled = false;

        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Analytics {
        private Duration window = Duration.ofDays(30);

        private int recentJobsLimit = 10;
    }
}
