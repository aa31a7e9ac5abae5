package com.castleflow.castleflow_backend.model.execution;

public record NotificationEntry(String message, NotificationSeverity severity, long timestamp) {
}
