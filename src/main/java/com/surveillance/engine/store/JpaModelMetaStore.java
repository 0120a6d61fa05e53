package com.surveillance.engine.store;

import com.surveillance.engine.entity.ModelTrainingMeta;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.exception.ConcurrencyConflictException;
import com.surveillance.engine.repository.ModelTrainingMetaRepository;
import com.surveillance.engine.repository.TrainingTriggerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link ModelMetaStore} over the {@code ml_models} table.
 *
 * An update holds a {@code SELECT ... FOR UPDATE} row lock from the read until commit, so
 * concurrent detections for the same model queue on the row instead of failing. The
 * {@code revision} version column is checked again on flush.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaModelMetaStore implements ModelMetaStore {

    private final ModelTrainingMetaRepository metaRepository;
    private final TrainingTriggerRepository triggerRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Lookup getOrCreate(String modelType, Supplier<ModelTrainingMeta> defaults) {
        Optional<ModelTrainingMeta> existing = metaRepository.findById(modelType);
        if (existing.isPresent()) {
            return new Lookup(existing.get(), true);
        }

        try {
            ModelTrainingMeta created = metaRepository.saveAndFlush(defaults.get());
            log.debug("Inserted retraining counter for {}", modelType);
            return new Lookup(created, false);
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("Counter for " + modelType + " was created concurrently", e);
        }
    }

    @Override
    @Transactional
    public Applied conditionalUpdate(String modelType, Function<ModelTrainingMeta, CounterMutation> mutation) {
        ModelTrainingMeta current = metaRepository.findForUpdate(modelType)
            .orElseThrow(() -> new ConcurrencyConflictException("Counter for " + modelType + " does not exist yet"));

        CounterMutation change = mutation.apply(current);
        CounterUpdate update = change.update();
        current.setNewDataCount(update.newDataCount());
        current.setTotalDataCount(update.totalDataCount());
        current.setStatus(update.status());
        current.setUpdatedAt(clock.instant());

        ModelTrainingMeta saved = metaRepository.saveAndFlush(current);

        TrainingTrigger trigger = change.trigger();
        if (trigger != null) {
            trigger = triggerRepository.save(trigger);
        }
        return new Applied(saved, trigger);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ModelTrainingMeta> find(String modelType) {
        return metaRepository.findById(modelType);
    }
}
