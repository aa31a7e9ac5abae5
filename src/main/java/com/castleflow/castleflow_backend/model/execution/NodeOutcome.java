package com.castleflow.castleflow_backend.model.execution;

/**
 * What a node executor hands back to the engine: the node's result and the output port
 * to continue on. A {@code null} port stops traversal at this node.
 */
public record NodeOutcome(Object result, String activePort) {

    public static final String OUT = "out";

    public static NodeOutcome next(Object result) {
        return new NodeOutcome(result, OUT);
    }

    public static NodeOutcome next(Object result, String port) {
        return new NodeOutcome(result, port);
    }

    public static NodeOutcome halt(Object result) {
        return new NodeOutcome(result, null);
    }
}
