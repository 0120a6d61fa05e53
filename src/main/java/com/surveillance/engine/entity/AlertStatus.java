package com.surveillance.engine.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AlertStatus {
    @JsonProperty("active")
    ACTIVE,

    @JsonProperty("resolved")
    RESOLVED
}
