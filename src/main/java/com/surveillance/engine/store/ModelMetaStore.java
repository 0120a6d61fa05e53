package com.surveillance.engine.store;

import com.surveillance.engine.entity.ModelStatus;
import com.surveillance.engine.entity.ModelTrainingMeta;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.exception.ConcurrencyConflictException;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Conditional-write access to the per-model retraining counters.
 *
 * Every counter mutation goes through {@link #conditionalUpdate}, which reads the current
 * counter and writes the mutation computed from it as one atomic step. Concurrent updates
 * of the same counter are serialized by the store; implementations signal a write they
 * could not apply with {@link ConcurrencyConflictException} and callers retry.
 */
public interface ModelMetaStore {

    /**
     * Returns the counter for {@code modelType}, inserting {@code defaults} if none exists.
     *
     * @throws ConcurrencyConflictException if another writer created it at the same time
     */
    Lookup getOrCreate(String modelType, Supplier<ModelTrainingMeta> defaults);

    /**
     * Applies {@code mutation} to the current counter of {@code modelType}. No other writer
     * can change the counter between the read handed to {@code mutation} and the write.
     * When the mutation carries a trigger it is inserted in the same unit of work, so a
     * trigger exists if and only if the update that produced it committed.
     *
     * @return the counter as stored after the update, with the trigger written
     * @throws ConcurrencyConflictException if the counter does not exist or the write was refused
     */
    Applied conditionalUpdate(String modelType, Function<ModelTrainingMeta, CounterMutation> mutation);

    Optional<ModelTrainingMeta> find(String modelType);

    /**
     * Result of {@link #getOrCreate}.
     *
     * @param meta    the stored counter
     * @param existed false when this call inserted it
     */
    record Lookup(ModelTrainingMeta meta, boolean existed) {
    }

    /**
     * New values for the counter-owned fields.
     */
    record CounterUpdate(int newDataCount, long totalDataCount, ModelStatus status) {
    }

    /**
     * What to write: the counter fields, plus a training trigger or null.
     */
    record CounterMutation(CounterUpdate update, TrainingTrigger trigger) {
    }

    /**
     * Result of {@link #conditionalUpdate}.
     *
     * @param meta    the counter after the write
     * @param trigger the trigger inserted with it, or null
     */
    record Applied(ModelTrainingMeta meta, TrainingTrigger trigger) {
    }
}
