package com.surveillance.engine.event;

import com.surveillance.engine.dto.DetectionRecord;

/**
 * Published once per detection written to {@code detection_patterns}.
 */
public record DetectionCreatedEvent(String detectionId, DetectionRecord detection) {
}
