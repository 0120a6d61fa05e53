package com.surveillance.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A flagged spatial/temporal cluster of high-confidence detections.
 *
 * Alerts are created {@link AlertStatus#ACTIVE}; resolving them belongs to the operator
 * workflow, not to this engine. One alert is written per qualifying detection event,
 * so overlapping windows can yield several alerts for the same area unless duplicate
 * suppression is switched on.
 */
@Entity
@Table(name = "outbreak_alerts", indexes = {
    @Index(name = "idx_alert_status", columnList = "status"),
    @Index(name = "idx_alert_status_time", columnList = "status, alert_timestamp")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OutbreakAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 50)
    private AlertType alertType;

    @Column(name = "severity_level", nullable = false)
    private Integer severityLevel;

    /**
     * Coordinates of the detection that tipped the cluster over the threshold.
     */
    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "radius_km", nullable = false)
    private Double radiusKm;

    @Column(length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AlertStatus status = AlertStatus.ACTIVE;

    @Column(name = "alert_timestamp", nullable = false)
    private Instant alertTimestamp;

    @Embedded
    private AlertMetadata metadata;
}
