package com.surveillance.engine.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TriggerReason {
    @JsonProperty("data_threshold_reached")
    DATA_THRESHOLD_REACHED,

    @JsonProperty("manual_trigger")
    MANUAL_TRIGGER
}
