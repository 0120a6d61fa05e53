package com.surveillance.engine.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of anomaly an outbreak alert reports.
 */
public enum AlertType {
    @JsonProperty("population_spike")
    POPULATION_SPIKE
}
