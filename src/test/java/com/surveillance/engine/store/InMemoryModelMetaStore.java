package com.surveillance.engine.store;

import com.surveillance.engine.entity.ModelTrainingMeta;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.exception.ConcurrencyConflictException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Store kept in memory that serializes updates per instance, for exercising the counter
 * under real thread contention.
 */
public class InMemoryModelMetaStore implements ModelMetaStore {

    private final Map<String, ModelTrainingMeta> rows = new HashMap<>();
    private final List<TrainingTrigger> triggers = new ArrayList<>();

    @Override
    public synchronized Lookup getOrCreate(String modelType, Supplier<ModelTrainingMeta> defaults) {
        ModelTrainingMeta existing = rows.get(modelType);
        if (existing != null) {
            return new Lookup(existing.toBuilder().build(), true);
        }
        ModelTrainingMeta created = defaults.get().toBuilder().revision(0L).build();
        rows.put(modelType, created);
        return new Lookup(created.toBuilder().build(), false);
    }

    @Override
    public synchronized Applied conditionalUpdate(String modelType,
                                                  Function<ModelTrainingMeta, CounterMutation> mutation) {
        ModelTrainingMeta current = rows.get(modelType);
        if (current == null) {
            throw new ConcurrencyConflictException("no counter for " + modelType);
        }

        CounterMutation change = mutation.apply(current.toBuilder().build());
        ModelTrainingMeta next = current.toBuilder()
            .newDataCount(change.update().newDataCount())
            .totalDataCount(change.update().totalDataCount())
            .status(change.update().status())
            .revision(current.getRevision() + 1)
            .build();
        rows.put(modelType, next);

        TrainingTrigger trigger = change.trigger();
        if (trigger != null) {
            trigger.setId(UUID.randomUUID().toString());
            triggers.add(trigger);
        }
        return new Applied(next.toBuilder().build(), trigger);
    }

    @Override
    public synchronized Optional<ModelTrainingMeta> find(String modelType) {
        return Optional.ofNullable(rows.get(modelType)).map(m -> m.toBuilder().build());
    }

    public synchronized void put(ModelTrainingMeta meta) {
        rows.put(meta.getModelType(), meta.toBuilder().build());
    }

    public synchronized List<TrainingTrigger> triggers() {
        return new ArrayList<>(triggers);
    }
}
