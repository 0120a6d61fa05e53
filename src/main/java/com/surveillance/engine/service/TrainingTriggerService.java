package com.surveillance.engine.service;

import com.surveillance.engine.dto.ManualTriggerRequest;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.entity.TriggerReason;
import com.surveillance.engine.entity.TriggerStatus;
import com.surveillance.engine.entity.TriggerType;
import com.surveillance.engine.exception.InvalidRequestException;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.repository.TrainingTriggerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Operator-initiated training triggers.
 *
 * Independent of the retraining counters: a manual trigger neither reads nor resets
 * them, and may coexist with a pending automatic trigger for the same model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingTriggerService {

    private final TrainingTriggerRepository triggerRepository;
    private final Clock clock;

    /**
     * @throws InvalidRequestException if the model type is blank
     * @throws StorageException        if the trigger cannot be written
     */
    public TrainingTrigger triggerManually(ManualTriggerRequest request) {
        ManualTriggerRequest effective = request != null ? request : ManualTriggerRequest.defaults();
        String modelType = effective.resolvedModelType();
        boolean force = effective.resolvedForce();

        if (modelType.isEmpty()) {
            throw new InvalidRequestException("modelType must not be blank");
        }

        TrainingTrigger trigger = TrainingTrigger.builder()
            .type(force ? TriggerType.FULL : TriggerType.SCHEDULED)
            .modelType(modelType)
            .triggerReason(TriggerReason.MANUAL_TRIGGER)
            .forceRetrain(force)
            .status(TriggerStatus.PENDING)
            .createdAt(clock.instant())
            .build();

        try {
            TrainingTrigger saved = triggerRepository.save(trigger);
            log.info("Manual training trigger {} created for {} (force={})", saved.getId(), modelType, force);
            return saved;
        } catch (DataAccessException e) {
            throw StorageException.translate("create training trigger for " + modelType, e);
        }
    }
}
