package com.surveillance.engine.exception;

import lombok.Getter;

/**
 * Processing of one detection failed. The cause is the first hard error hit by either
 * the anomaly evaluation or the retraining counter update.
 */
@Getter
public class DetectionProcessingException extends RuntimeException {

    private final String detectionId;

    public DetectionProcessingException(String detectionId, Throwable cause) {
        super("Failed to process detection " + detectionId + ": " + cause.getMessage(), cause);
        this.detectionId = detectionId;
    }
}
