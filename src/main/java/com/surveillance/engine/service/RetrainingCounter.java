package com.surveillance.engine.service;

import com.surveillance.engine.config.SurveillanceProperties;
import com.surveillance.engine.entity.ModelStatus;
import com.surveillance.engine.entity.ModelTrainingMeta;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.entity.TriggerReason;
import com.surveillance.engine.entity.TriggerStatus;
import com.surveillance.engine.entity.TriggerType;
import com.surveillance.engine.exception.ConcurrencyConflictException;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.store.ModelMetaStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-model counter of detections since the last training trigger.
 *
 * One call per processed detection and model:
 * - no counter yet: create it at newDataCount = 1, status INITIALIZED, no threshold check
 * - otherwise: increment; reaching the threshold writes a SCHEDULED trigger carrying the
 *   incremented count and resets the counter to 0 / RETRAINING_QUEUED
 *
 * Increment, threshold check and reset happen in one conditional update that the store
 * serializes per model, so concurrent detections neither lose increments nor both claim
 * the same threshold crossing. Refused writes (a racing first insert, a lock wait that
 * timed out) are retried with jittered exponential backoff.
 */
@Service
@Slf4j
public class RetrainingCounter {

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final double BACKOFF_JITTER = 0.5;

    private final ModelMetaStore metaStore;
    private final SurveillanceProperties properties;
    private final Clock clock;
    private final Retry conflictRetry;

    public RetrainingCounter(ModelMetaStore metaStore, SurveillanceProperties properties, Clock clock) {
        this.metaStore = metaStore;
        this.properties = properties;
        this.clock = clock;

        SurveillanceProperties.Retraining retraining = properties.getRetraining();
        this.conflictRetry = Retry.of("retraining-counter", RetryConfig.custom()
            .maxAttempts(retraining.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                retraining.getBackoff(), BACKOFF_MULTIPLIER, BACKOFF_JITTER, retraining.getMaxBackoff()))
            .retryExceptions(ConcurrencyConflictException.class)
            .build());
    }

    /**
     * Counts one new detection against {@code modelType}.
     *
     * @throws StorageException if the store fails or keeps refusing the update
     */
    public CounterOutcome recordDetection(String modelType) {
        try {
            return conflictRetry.executeSupplier(() -> attempt(modelType));
        } catch (ConcurrencyConflictException e) {
            throw new StorageException("Retraining counter for " + modelType + " still contended after "
                + properties.getRetraining().getMaxAttempts() + " attempts", e);
        }
    }

    private CounterOutcome attempt(String modelType) {
        try {
            ModelMetaStore.Lookup lookup = metaStore.getOrCreate(modelType, () -> initialMeta(modelType));
            if (!lookup.existed()) {
                log.info("Initialized retraining counter for {}", modelType);
                return new CounterOutcome(lookup.meta(), null);
            }

            ModelMetaStore.Applied applied = metaStore.conditionalUpdate(modelType, this::nextState);
            if (applied.trigger() != null) {
                log.info("ML retraining triggered for {} after {} new detections (trigger {})",
                    modelType, applied.trigger().getDataCount(), applied.trigger().getId());
            } else {
                log.debug("Retraining counter for {} at {}", modelType, applied.meta().getNewDataCount());
            }
            return new CounterOutcome(applied.meta(), applied.trigger());

        } catch (ConcurrencyFailureException e) {
            throw new ConcurrencyConflictException("Counter for " + modelType + " is contended", e);
        } catch (DataAccessException e) {
            throw StorageException.translate("update retraining counter for " + modelType, e);
        }
    }

    private ModelMetaStore.CounterMutation nextState(ModelTrainingMeta current) {
        int newDataCount = current.getNewDataCount() + 1;
        long totalDataCount = current.getTotalDataCount() + 1;

        if (newDataCount < properties.getRetraining().getThreshold()) {
            return new ModelMetaStore.CounterMutation(
                new ModelMetaStore.CounterUpdate(newDataCount, totalDataCount, accumulatingStatus(current)),
                null
            );
        }

        TrainingTrigger trigger = TrainingTrigger.builder()
            .type(TriggerType.SCHEDULED)
            .modelType(current.getModelType())
            .triggerReason(TriggerReason.DATA_THRESHOLD_REACHED)
            .forceRetrain(false)
            .dataCount(newDataCount)
            .status(TriggerStatus.PENDING)
            .createdAt(clock.instant())
            .build();

        return new ModelMetaStore.CounterMutation(
            new ModelMetaStore.CounterUpdate(0, totalDataCount, ModelStatus.RETRAINING_QUEUED),
            trigger
        );
    }

    private ModelTrainingMeta initialMeta(String modelType) {
        Instant now = clock.instant();
        return ModelTrainingMeta.builder()
            .modelType(modelType)
            .lastTrained(now)
            .version(properties.getRetraining().getInitialVersion())
            .newDataCount(1)
            .totalDataCount(1)
            .accuracy(0.0)
            .status(ModelStatus.INITIALIZED)
            .updatedAt(now)
            .build();
    }

    // A model the worker is currently training keeps that status until the worker moves it on
    private static ModelStatus accumulatingStatus(ModelTrainingMeta current) {
        return current.getStatus() == ModelStatus.TRAINING ? ModelStatus.TRAINING : ModelStatus.ACCUMULATING;
    }
}
