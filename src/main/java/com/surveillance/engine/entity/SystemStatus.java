package com.surveillance.engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Heartbeat document in {@code system_status}, keyed by check name ("health").
 */
@Entity
@Table(name = "system_status")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemStatus {

    @Id
    @Column(length = 50)
    private String name;

    @Column(nullable = false, length = 30)
    private String status;

    @Column(name = "last_check")
    private Instant lastCheck;

    @Column(name = "functions_active")
    private boolean functionsActive;

    @Column(name = "project_id", length = 100)
    private String projectId;
}
