package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.executor.NodeExecutor;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Executes js_execute nodes. The node's {@code script} is the body of an async function:
 * <pre>
 *   const user = await api.variables.get('user');
 *   vars.greeting = `Hello ${user.name}`;
 *   return inp._result;
 * </pre>
 * The returned value becomes the node result. A node without a script passes {@code null} on.
 */
@Component
@RequiredArgsConstructor
public class ScriptExecutor implements NodeExecutor {

    private final ScriptSandbox sandbox;

    @Override
    public NodeType supportedType() {
        return NodeType.JS_EXECUTE;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        String script = node.getScript();
        if (script == null || script.isBlank()) {
            return NodeOutcome.next(null);
        }
        return NodeOutcome.next(sandbox.execute(script, ctx.getApi(), input, ctx.getVariables()));
    }
}
