package com.surveillance.engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cluster statistics captured at the moment an alert fired.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertMetadata {

    @Column(name = "detection_count")
    private Integer detectionCount;

    @Column(name = "avg_confidence")
    private Double avgConfidence;

    @Column(name = "triggering_detection_id", length = 64)
    private String triggeringDetectionId;
}
