package com.castleflow.castleflow_backend.engine;

public class FlowExecutionException extends RuntimeException {

    public FlowExecutionException(String message) {
        super(message);
    }

    public FlowExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
