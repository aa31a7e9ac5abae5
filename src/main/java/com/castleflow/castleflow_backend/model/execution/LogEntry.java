package com.castleflow.castleflow_backend.model.execution;

public record LogEntry(LogLevel level, String message, long timestamp) {
}
