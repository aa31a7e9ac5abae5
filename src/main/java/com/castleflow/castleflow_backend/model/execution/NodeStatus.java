package com.castleflow.castleflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeStatus {
    RUNNING,
    COMPLETED,
    ERROR,
    SKIPPED;

    @JsonValue
    public String getKey() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static NodeStatus fromKey(String key) {
        return valueOf(key.toUpperCase());
    }
}
