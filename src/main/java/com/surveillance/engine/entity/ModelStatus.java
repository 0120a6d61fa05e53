package com.surveillance.engine.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * States of a model's retraining counter.
 *
 * <pre>
 * (absent) -> INITIALIZED -> ACCUMULATING -> RETRAINING_QUEUED -> ACCUMULATING -> ...
 * </pre>
 *
 * {@code TRAINING} and {@code TRAINED} are written by the external training worker.
 */
public enum ModelStatus {
    @JsonProperty("initialized")
    INITIALIZED,

    @JsonProperty("accumulating")
    ACCUMULATING,

    @JsonProperty("retraining_queued")
    RETRAINING_QUEUED,

    @JsonProperty("training")
    TRAINING,

    @JsonProperty("trained")
    TRAINED
}
