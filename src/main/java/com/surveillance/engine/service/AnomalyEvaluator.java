package com.surveillance.engine.service;

import com.surveillance.engine.config.SurveillanceProperties;
import com.surveillance.engine.dto.DetectionRecord;
import com.surveillance.engine.dto.GeoWindow;
import com.surveillance.engine.entity.AlertMetadata;
import com.surveillance.engine.entity.AlertStatus;
import com.surveillance.engine.entity.AlertType;
import com.surveillance.engine.entity.DetectionPattern;
import com.surveillance.engine.entity.OutbreakAlert;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.repository.DetectionPatternRepository;
import com.surveillance.engine.repository.OutbreakAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a new detection completes a population-spike cluster.
 *
 * Algorithm:
 * 1. Build a square window of ±windowDegrees around the detection and a time floor of now - lookback
 * 2. Query the store on latitude range and time floor (one inequality axis per query)
 * 3. Post-filter longitude in memory
 * 4. With at least minDetections in the cluster, average their confidence
 * 5. If the mean is strictly above minAvgConfidence, write one OutbreakAlert
 *
 * Not alerting is a normal outcome, never an error. The candidate set includes the
 * triggering detection itself, since it is already persisted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyEvaluator {

    private final DetectionPatternRepository detectionRepository;
    private final OutbreakAlertRepository alertRepository;
    private final SurveillanceProperties properties;
    private final Clock clock;

    /**
     * Evaluates the cluster around {@code detection}.
     *
     * @param detection   the newly persisted detection
     * @param detectionId its store id, recorded on the alert
     * @return the alert written, or empty if the cluster does not qualify
     * @throws StorageException if the window query or the alert write fails
     */
    public Optional<OutbreakAlert> evaluate(DetectionRecord detection, String detectionId) {
        if (!detection.hasLocation()) {
            log.warn("Missing location data in detection {}", detectionId);
            return Optional.empty();
        }

        SurveillanceProperties.Anomaly policy = properties.getAnomaly();
        Instant now = clock.instant();
        GeoWindow window = GeoWindow.around(detection.latitude(), detection.longitude(), policy.getWindowDegrees());

        List<DetectionPattern> cluster = findCluster(window, now.minus(policy.getLookback()));

        if (cluster.size() < policy.getMinDetections()) {
            log.debug("Cluster around {} has {} detections, below {}",
                detectionId, cluster.size(), policy.getMinDetections());
            return Optional.empty();
        }

        double avgConfidence = cluster.stream()
            .mapToDouble(d -> d.getConfidenceScore() != null ? d.getConfidenceScore() : 0.0)
            .average()
            .orElse(0.0);

        if (avgConfidence <= policy.getMinAvgConfidence()) {
            log.debug("Cluster around {} has mean confidence {}, not above {}",
                detectionId, avgConfidence, policy.getMinAvgConfidence());
            return Optional.empty();
        }

        if (policy.isSuppressDuplicates() && hasActiveAlertInWindow(window, now.minus(policy.getDuplicateWindow()))) {
            log.info("Population spike around {} already has an active alert, suppressing", detectionId);
            return Optional.empty();
        }

        OutbreakAlert alert = OutbreakAlert.builder()
            .alertType(AlertType.POPULATION_SPIKE)
            .severityLevel(policy.getSeverityLevel())
            .latitude(detection.latitude())
            .longitude(detection.longitude())
            .radiusKm(policy.getRadiusKm())
            .description(String.format(
                "Potential population spike detected with %d observations", cluster.size()))
            .status(AlertStatus.ACTIVE)
            .alertTimestamp(now)
            .metadata(AlertMetadata.builder()
                .detectionCount(cluster.size())
                .avgConfidence(avgConfidence)
                .triggeringDetectionId(detectionId)
                .build())
            .build();

        try {
            OutbreakAlert saved = alertRepository.save(alert);
            log.info("Created outbreak alert {} for area: {}, {} ({} detections, mean confidence {})",
                saved.getId(), detection.latitude(), detection.longitude(), cluster.size(),
                String.format("%.3f", avgConfidence));
            return Optional.of(saved);
        } catch (DataAccessException e) {
            throw StorageException.translate("write outbreak alert", e);
        }
    }

    private List<DetectionPattern> findCluster(GeoWindow window, Instant since) {
        List<DetectionPattern> latitudeBand;
        try {
            latitudeBand = detectionRepository.findByLatitudeBetweenAndDetectionTimestampGreaterThanEqual(
                window.minLatitude(),
                window.maxLatitude(),
                since
            );
        } catch (DataAccessException e) {
            throw StorageException.translate("query detection window", e);
        }

        return latitudeBand.stream()
            .filter(d -> window.contains(d.getLatitude(), d.getLongitude()))
            .toList();
    }

    private boolean hasActiveAlertInWindow(GeoWindow window, Instant since) {
        try {
            return alertRepository.existsInArea(
                AlertStatus.ACTIVE,
                window.minLatitude(),
                window.maxLatitude(),
                window.minLongitude(),
                window.maxLongitude(),
                since
            );
        } catch (DataAccessException e) {
            throw StorageException.translate("look up active alerts", e);
        }
    }
}
