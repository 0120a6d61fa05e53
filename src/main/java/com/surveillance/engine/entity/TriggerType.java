package com.surveillance.engine.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Depth of retraining requested. {@code FULL} is only produced by a forced manual trigger.
 */
public enum TriggerType {
    @JsonProperty("scheduled")
    SCHEDULED,

    @JsonProperty("full")
    FULL
}
