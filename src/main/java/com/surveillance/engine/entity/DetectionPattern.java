package com.surveillance.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A single field observation as persisted in the {@code detection_patterns} collection.
 *
 * Write-once: the ingestion path creates it and nothing in the engine mutates it afterwards.
 * Coordinates are nullable because records can arrive from ingestion paths that do not
 * geolocate; such records are counted for retraining but never windowed.
 *
 * The composite latitude/timestamp index backs the single-axis window query used by
 * the anomaly evaluator.
 */
@Entity
@Table(name = "detection_patterns", indexes = {
    @Index(name = "idx_detection_lat_time", columnList = "latitude, detection_timestamp"),
    @Index(name = "idx_detection_timestamp", columnList = "detection_timestamp")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DetectionPattern {

    /**
     * Opaque document id assigned by the store.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    private Double latitude;

    private Double longitude;

    @Column(length = 255)
    private String species;

    /**
     * Classifier confidence in [0, 1]. Missing scores count as 0 when averaged.
     */
    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "detection_timestamp", nullable = false)
    private Instant detectionTimestamp;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    @Embedded
    private EnvironmentalContext environmentalContext;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
