package com.surveillance.engine.service;

import com.surveillance.engine.config.SurveillanceProperties;
import com.surveillance.engine.dto.AnalyticsReport;
import com.surveillance.engine.entity.AlertStatus;
import com.surveillance.engine.entity.ModelTrainingMeta;
import com.surveillance.engine.entity.OutbreakAlert;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.repository.DetectionPatternRepository;
import com.surveillance.engine.repository.OutbreakAlertRepository;
import com.surveillance.engine.repository.TrainingTriggerRepository;
import com.surveillance.engine.store.ModelMetaStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only aggregations over stored state.
 */
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private final DetectionPatternRepository detectionRepository;
    private final OutbreakAlertRepository alertRepository;
    private final TrainingTriggerRepository triggerRepository;
    private final ModelMetaStore metaStore;
    private final SurveillanceProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AnalyticsReport getAnalytics() {
        SurveillanceProperties.Analytics analytics = properties.getAnalytics();
        Instant now = clock.instant();

        try {
            long detections = detectionRepository.countByDetectionTimestampGreaterThanEqual(
                now.minus(analytics.getWindow()));
            long activeAlerts = alertRepository.countByStatus(AlertStatus.ACTIVE);
            List<TrainingTrigger> recentJobs = triggerRepository.findByOrderByCreatedAtDesc(
                PageRequest.of(0, analytics.getRecentJobsLimit()));

            return new AnalyticsReport(detections, activeAlerts, recentJobs, now);
        } catch (DataAccessException e) {
            throw StorageException.translate("compute analytics", e);
        }
    }

    @Transactional(readOnly = true)
    public List<OutbreakAlert> getActiveAlerts() {
        try {
            return alertRepository.findByStatusOrderByAlertTimestampDesc(AlertStatus.ACTIVE);
        } catch (DataAccessException e) {
            throw StorageException.translate("list active alerts", e);
        }
    }

    public Optional<ModelTrainingMeta> getModelMeta(String modelType) {
        try {
            return metaStore.find(modelType);
        } catch (DataAccessException e) {
            throw StorageException.translate("read counter for " + modelType, e);
        }
    }
}
