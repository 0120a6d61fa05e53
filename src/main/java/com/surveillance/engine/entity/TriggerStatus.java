package com.surveillance.engine.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a training trigger. The engine only ever writes {@code PENDING}.
 */
public enum TriggerStatus {
    @JsonProperty("pending")
    PENDING,

    @JsonProperty("running")
    RUNNING,

    @JsonProperty("completed")
    COMPLETED,

    @JsonProperty("error")
    ERROR
}
