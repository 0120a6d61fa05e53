package com.surveillance.engine.dto;

import com.surveillance.engine.entity.TrainingTrigger;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated view for the dashboard.
 *
 * @param detectionsLast30Days detections observed inside the analytics window
 * @param activeAlerts         outbreak alerts still active
 * @param recentTrainingJobs   newest training triggers first, bounded in size
 * @param timestamp            when the report was computed
 */
public record AnalyticsReport(
    long detectionsLast30Days,
    long activeAlerts,
    List<TrainingTrigger> recentTrainingJobs,
    Instant timestamp
) {
}
