package com.surveillance.engine.dto;

import com.surveillance.engine.entity.DetectionPattern;
import com.surveillance.engine.entity.EnvironmentalContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;

import java.time.Instant;

/**
 * Payload for ingesting a detection over REST or STOMP.
 *
 * @param latitude            degrees, WGS84
 * @param longitude           degrees, WGS84
 * @param species             reported species
 * @param confidenceScore     classifier confidence in [0, 1]
 * @param detectionTimestamp  observation time; defaults to ingestion time when absent
 * @param imageUrl            optional evidence image
 * @param environmentalContext optional weather snapshot
 */
public record DetectionRequest(
    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @NotBlank(message = "Species cannot be blank")
    @Size(max = 255)
    String species,

    @NotNull(message = "Confidence score is required")
    @DecimalMin(value = "0.0", message = "Confidence score must be >= 0")
    @DecimalMax(value = "1.0", message = "Confidence score must be <= 1")
    Double confidenceScore,

    Instant detectionTimestamp,

    @Size(max = 1000)
    String imageUrl,

    @Valid
    EnvironmentalContextRequest environmentalContext
) {

    public DetectionPattern toEntity(Instant receivedAt) {
        return DetectionPattern.builder()
            .latitude(latitude)
            .longitude(longitude)
            .species(species)
            .confidenceScore(confidenceScore)
            .detectionTimestamp(detectionTimestamp != null ? detectionTimestamp : receivedAt)
            .imageUrl(imageUrl)
            .environmentalContext(environmentalContext != null ? environmentalContext.toEmbeddable() : null)
            .build();
    }

    /**
     * @param temperature degrees Celsius
     * @param humidity    relative humidity, percent
     * @param weather     free-form conditions, e.g. "clear"
     */
    public record EnvironmentalContextRequest(
        Double temperature,

        @DecimalMin(value = "0.0", message = "Humidity must be >= 0")
        @DecimalMax(value = "100.0", message = "Humidity must be <= 100")
        Double humidity,

        @Size(max = 100)
        String weather
    ) {
        EnvironmentalContext toEmbeddable() {
            return new EnvironmentalContext(temperature, humidity, weather);
        }
    }
}
