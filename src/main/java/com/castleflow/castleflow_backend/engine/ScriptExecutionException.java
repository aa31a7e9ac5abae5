package com.castleflow.castleflow_backend.engine;

public class ScriptExecutionException extends FlowExecutionException {

    public ScriptExecutionException(String message) {
        super(message);
    }

    public ScriptExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
