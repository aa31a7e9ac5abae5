package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class StartExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.START;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        return NodeOutcome.next(null);
    }
}
