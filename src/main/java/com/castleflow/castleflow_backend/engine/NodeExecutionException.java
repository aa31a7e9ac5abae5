package com.castleflow.castleflow_backend.engine;

public class NodeExecutionException extends FlowExecutionException {

    public NodeExecutionException(String message) {
        super(message);
    }

    public NodeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
