package com.castleflow.castleflow_backend.engine;

// Stops the whole run; never routed through an error port
public class FatalExecutionException extends FlowExecutionException {

    public FatalExecutionException(String message) {
        super(message);
    }
}
