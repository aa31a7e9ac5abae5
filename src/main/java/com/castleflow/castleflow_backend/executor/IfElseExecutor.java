package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Branches on the JavaScript truthiness of {@code config.condition}.
 * An empty condition is false.
 */
@Component
@RequiredArgsConstructor
public class IfElseExecutor implements NodeExecutor {

    private final ScriptSandbox sandbox;

    @Override
    public NodeType supportedType() {
        return NodeType.IF_ELSE;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        String condition = NodeConfig.of(node).text("condition");
        boolean result = condition != null && sandbox.test(condition, ctx.getApi(), input, ctx.getVariables());
        return NodeOutcome.next(result, result ? "true" : "false");
    }
}
