package com.surveillance.engine.dto;

import com.surveillance.engine.entity.DetectionPattern;
import com.surveillance.engine.entity.EnvironmentalContext;

import java.time.Instant;

/**
 * Immutable view of a persisted detection, as handed to the event handler.
 *
 * @param latitude            degrees, may be null if the ingestion path could not geolocate
 * @param longitude           degrees, may be null likewise
 * @param species             reported species
 * @param confidenceScore     classifier confidence in [0, 1]
 * @param detectionTimestamp  when the observation was made
 * @param imageUrl            optional evidence image
 * @param environmentalContext optional weather snapshot
 */
public record DetectionRecord(
    Double latitude,
    Double longitude,
    String species,
    Double confidenceScore,
    Instant detectionTimestamp,
    String imageUrl,
    EnvironmentalContext environmentalContext
) {

    public static DetectionRecord fromEntity(DetectionPattern detection) {
        return new DetectionRecord(
            detection.getLatitude(),
            detection.getLongitude(),
            detection.getSpecies(),
            detection.getConfidenceScore(),
            detection.getDetectionTimestamp(),
            detection.getImageUrl(),
            detection.getEnvironmentalContext()
        );
    }

    /**
     * Whether the record can be placed in a spatial window at all.
     */
    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public String toLogString() {
        return String.format(
            "Detection[species=%s, lat=%s, lon=%s, confidence=%s, time=%s]",
            species, latitude, longitude, confidenceScore, detectionTimestamp
        );
    }
}
