package com.castleflow.castleflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationSeverity {
    SUCCESS,
    INFO,
    WARNING,
    ERROR;

    @JsonValue
    public String getKey() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static NotificationSeverity fromKey(String key) {
        if (key != null) {
            for (NotificationSeverity severity : values()) {
                if (severity.getKey().equalsIgnoreCase(key.trim())) {
                    return severity;
                }
            }
        }
        return INFO;
    }
}
