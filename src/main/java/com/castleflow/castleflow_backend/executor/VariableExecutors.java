package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
class ReadVariableExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.READ_VARIABLE;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        String name = NodeConfig.of(node).text("variableName");
        return NodeOutcome.next(name != null ? ctx.getVariables().get(name) : null);
    }
}

/*
 * Config shape:
 * {
 *   "variableName": "counter",
 *   "value":        0          // any JSON value, stored as-is
 * }
 */
@Component
class WriteVariableExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.WRITE_VARIABLE;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        String name = config.text("variableName");
        Object value = config.raw("value");
        if (name != null) {
            ctx.getVariables().put(name, value);
        }
        return NodeOutcome.next(value);
    }
}
