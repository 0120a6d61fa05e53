package com.surveillance.engine.service;

import com.surveillance.engine.entity.ModelTrainingMeta;
import com.surveillance.engine.entity.TrainingTrigger;

/**
 * What one counter update did.
 *
 * @param meta    the counter as stored afterwards
 * @param trigger the training trigger created by this update, or null
 */
public record CounterOutcome(ModelTrainingMeta meta, TrainingTrigger trigger) {

    public boolean triggered() {
        return trigger != null;
    }
}
