package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.model.execution.ExecutionLogEntry;

/**
 * Progress callbacks fired synchronously on the executing thread.
 * Every method defaults to a no-op so callers only override what they display.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() { };

    default void onNodeStart(String nodeId) {
    }

    default void onNodeComplete(String nodeId, Object result) {
    }

    default void onNodeError(String nodeId, String error) {
    }

    default void onLog(ExecutionLogEntry entry) {
    }
}
