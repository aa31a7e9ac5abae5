package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.executor.NodeExecutor;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;

// Speech capture needs a user at a microphone; flows only get here on a client runtime
@Component
public class SttExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.STT;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        ctx.getApi().log().info("STT node requires user interaction");
        return NodeOutcome.next(null);
    }
}
