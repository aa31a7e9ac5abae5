package com.castleflow.castleflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a flow (or a node type) is allowed to run.
 * A missing runtime tag on a flow means {@link #UNIVERSAL}.
 */
public enum FlowRuntime {
    CLIENT,
    BACKEND,
    UNIVERSAL;

    @JsonValue
    public String getKey() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FlowRuntime fromKey(String key) {
        if (key == null || key.isBlank()) {
            return UNIVERSAL;
        }
        for (FlowRuntime runtime : values()) {
            if (runtime.getKey().equalsIgnoreCase(key.trim())) {
                return runtime;
            }
        }
        return UNIVERSAL;
    }

    public boolean isCompatibleWith(FlowRuntime engineRuntime) {
        return this == UNIVERSAL || engineRuntime == UNIVERSAL || this == engineRuntime;
    }
}
