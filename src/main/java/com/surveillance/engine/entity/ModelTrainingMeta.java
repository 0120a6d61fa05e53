package com.surveillance.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable retraining counter, one row per model type.
 *
 * The engine is the only writer of {@code newDataCount}, {@code totalDataCount} and the
 * counter-driven status values. The external training worker owns {@code lastTrained}
 * and {@code accuracy}.
 *
 * {@code revision} is the compare-and-swap token: every counter write is conditional on
 * the revision read, and bumps it. It doubles as the JPA version so that a fresh entity
 * (null revision) is always inserted rather than merged over a concurrently created row.
 */
@Entity
@Table(name = "ml_models")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ModelTrainingMeta {

    @Id
    @Column(name = "model_type", length = 100)
    private String modelType;

    @Column(name = "last_trained")
    private Instant lastTrained;

    /**
     * Semantic version of the deployed model, e.g. "1.0.0".
     */
    @Column(name = "model_version", length = 50)
    private String version;

    @Column(name = "new_data_count", nullable = false)
    private int newDataCount;

    @Column(name = "total_data_count", nullable = false)
    private long totalDataCount;

    @Column(nullable = false)
    private double accuracy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ModelStatus status;

    @Version
    private Long revision;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
