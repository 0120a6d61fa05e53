package com.surveillance.engine.dto;

/**
 * Body of a manual training trigger. Both fields are optional.
 *
 * @param modelType model to retrain; "all" when omitted
 * @param force     request a full rather than scheduled retrain; false when omitted
 */
public record ManualTriggerRequest(String modelType, Boolean force) {

    public static final String ALL_MODELS = "all";

    public static ManualTriggerRequest defaults() {
        return new ManualTriggerRequest(null, null);
    }

    public String resolvedModelType() {
        return modelType == null ? ALL_MODELS : modelType.trim();
    }

    public boolean resolvedForce() {
        return Boolean.TRUE.equals(force);
    }
}
