package com.surveillance.engine.dto;

public record TriggerResponse(boolean success, String message, String triggerId) {
}
