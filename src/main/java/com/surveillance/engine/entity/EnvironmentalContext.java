package com.surveillance.engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional weather snapshot captured alongside a detection.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnvironmentalContext {

    @Column(name = "env_temperature")
    private Double temperature;

    @Column(name = "env_humidity")
    private Double humidity;

    @Column(name = "env_weather", length = 100)
    private String weather;
}
