package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;

import java.util.Map;

public interface NodeExecutor {

    NodeType supportedType();

    // Runs the node's own logic; the engine follows the returned port afterwards
    NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx);
}
