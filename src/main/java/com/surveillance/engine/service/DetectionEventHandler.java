package com.surveillance.engine.service;

import com.surveillance.engine.config.SurveillanceProperties;
import com.surveillance.engine.dto.DetectionRecord;
import com.surveillance.engine.entity.OutbreakAlert;
import com.surveillance.engine.exception.DetectionProcessingException;
import com.surveillance.engine.exception.StorageTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for every newly persisted detection.
 *
 * Runs, in order, anomaly evaluation and then one retraining-counter update per
 * configured model type. The first hard failure aborts the invocation with a
 * {@link DetectionProcessingException}; nothing already written is rolled back, so an
 * alert may exist without the matching counter update and vice versa.
 *
 * Delivery is at least once. Re-running the same detection creates no inconsistent
 * state but does count it again unless the {@link DeliveryGuard} is enabled.
 */
@Service
@Slf4j
public class DetectionEventHandler {

    private final AnomalyEvaluator anomalyEvaluator;
    private final RetrainingCounter retrainingCounter;
    private final AlertBroadcaster alertBroadcaster;
    private final DeliveryGuard deliveryGuard;
    private final SurveillanceProperties properties;
    private final AsyncTaskExecutor executor;
    private final TimeLimiter timeLimiter;

    public DetectionEventHandler(
        AnomalyEvaluator anomalyEvaluator,
        RetrainingCounter retrainingCounter,
        AlertBroadcaster alertBroadcaster,
        DeliveryGuard deliveryGuard,
        SurveillanceProperties properties,
        @Qualifier("detectionProcessingExecutor") AsyncTaskExecutor executor
    ) {
        this.anomalyEvaluator = anomalyEvaluator;
        this.retrainingCounter = retrainingCounter;
        this.alertBroadcaster = alertBroadcaster;
        this.deliveryGuard = deliveryGuard;
        this.properties = properties;
        this.executor = executor;
        this.timeLimiter = TimeLimiter.of("detection-processing", TimeLimiterConfig.custom()
            .timeoutDuration(properties.getProcessing().getDeadline())
            .cancelRunningFuture(true)
            .build());
    }

    /**
     * Processes one detection under the configured deadline.
     *
     * @param detection   the persisted record
     * @param detectionId its store id
     * @throws DetectionProcessingException wrapping the first failure; a
     *         {@link StorageTimeoutException} cause means the deadline expired
     */
    public ProcessingResult handle(DetectionRecord detection, String detectionId) {
        log.info("New detection created: {} {}", detectionId, detection.toLogString());

        boolean claimed;
        try {
            claimed = deliveryGuard.claim(detectionId);
        } catch (RuntimeException e) {
            log.error("Error processing detection {}", detectionId, e);
            throw new DetectionProcessingException(detectionId, e);
        }
        if (!claimed) {
            log.warn("Detection {} was already processed, skipping redelivery", detectionId);
            return ProcessingResult.skipped(detectionId);
        }

        try {
            // Expiry cancels the task and interrupts its worker
            return timeLimiter.executeFutureSupplier(() -> executor.submit(() -> process(detection, detectionId)));
        } catch (TimeoutException e) {
            deliveryGuard.release(detectionId);
            StorageTimeoutException timeout = new StorageTimeoutException("Processing detection " + detectionId
                + " exceeded deadline of " + properties.getProcessing().getDeadline(), e);
            log.error("Error processing detection {}", detectionId, timeout);
            throw new DetectionProcessingException(detectionId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deliveryGuard.release(detectionId);
            throw new DetectionProcessingException(detectionId, e);
        } catch (Exception e) {
            deliveryGuard.release(detectionId);
            log.error("Error processing detection {}", detectionId, e);
            throw new DetectionProcessingException(detectionId, e);
        }
    }

    private ProcessingResult process(DetectionRecord detection, String detectionId) {
        Optional<OutbreakAlert> alert = anomalyEvaluator.evaluate(detection, detectionId);
        abortIfCancelled(detectionId);
        alert.ifPresent(alertBroadcaster::publish);

        List<CounterOutcome> counters = new ArrayList<>();
        for (String modelType : properties.getRetraining().getModelTypes()) {
            abortIfCancelled(detectionId);
            counters.add(retrainingCounter.recordDetection(modelType));
        }

        return new ProcessingResult(detectionId, alert.orElse(null), counters, false);
    }

    /**
     * Stops a worker whose caller already gave up, so no write lands after the
     * timeout has been reported.
     */
    private void abortIfCancelled(String detectionId) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Detection {} cancelled after deadline, skipping remaining writes", detectionId);
            throw new StorageTimeoutException("Processing detection " + detectionId + " was cancelled");
        }
    }
}
