package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.executor.NodeConfig;
import com.castleflow.castleflow_backend.executor.NodeExecutor;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class SystemApiExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.SYSTEM_API;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        String method = NodeConfig.of(node).text("apiMethod");
        if (method != null) {
            ctx.getApi().log().info("System API call: " + method);
        }
        return NodeOutcome.next(null);
    }
}
