package com.castleflow.castleflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LogLevel {
    INFO,
    WARN,
    ERROR,
    DEBUG;

    @JsonValue
    public String getKey() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static LogLevel fromKey(String key) {
        if (key != null) {
            for (LogLevel level : values()) {
                if (level.getKey().equalsIgnoreCase(key.trim())) {
                    return level;
                }
            }
        }
        return INFO;
    }
}
