package com.surveillance.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request record instructing the external training worker to retrain a model.
 *
 * Immutable once written, apart from {@code status}, which only the worker advances.
 */
@Entity
@Table(name = "training_triggers", indexes = {
    @Index(name = "idx_trigger_created_at", columnList = "created_at"),
    @Index(name = "idx_trigger_model_type", columnList = "model_type")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainingTrigger {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private TriggerType type;

    @Column(name = "model_type", nullable = false, length = 100)
    private String modelType;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_reason", nullable = false, length = 50)
    private TriggerReason triggerReason;

    @Column(name = "force_retrain", nullable = false)
    private boolean forceRetrain;

    /**
     * Counter snapshot at trigger time; null for manual triggers.
     */
    @Column(name = "data_count")
    private Integer dataCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TriggerStatus status = TriggerStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
