package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.model.domain.AutomateEdge;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-evaluates {@code condition} before every iteration and stops at the first falsy
 * result or after {@code maxIterations} (default 1000). Result is the iteration count.
 */
@Component
@RequiredArgsConstructor
public class WhileLoopExecutor implements NodeExecutor {

    private static final int DEFAULT_MAX_ITERATIONS = 1000;

    private final ScriptSandbox sandbox;

    @Override
    public NodeType supportedType() {
        return NodeType.WHILE_LOOP;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        String condition = config.text("condition");
        int maxIterations = config.integer("maxIterations", DEFAULT_MAX_ITERATIONS);
        List<AutomateEdge> body = ctx.getGraph().outgoing(node.getId(), ForLoopExecutor.BODY_PORT);

        int iteration = 0;
        while (iteration < maxIterations && !ctx.isAborted()) {
            boolean proceed = condition != null && sandbox.test(condition, ctx.getApi(), input, ctx.getVariables());
            if (!proceed) break;

            Map<String, Object> bodyInput = new LinkedHashMap<>(input);
            bodyInput.put("iteration", iteration);
            ctx.runBranches(body, bodyInput);
            iteration++;
        }
        return NodeOutcome.next(iteration, ForLoopExecutor.DONE_PORT);
    }
}
