package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;

// Editor annotation; never continues
@Component
public class CommentExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.COMMENT;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        return NodeOutcome.halt(null);
    }
}
