package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.NodeExecutionException;
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
 * Iterates an array produced by {@code sourceExpression} (default {@code inp._result}).
 * Each element goes out on the {@code loop} port as {@code _result}; afterwards the node
 * continues on {@code done} with the array length.
 *
 * Config shape:
 * {
 *   "sourceExpression": "inp._result.items",
 *   "itemVariable":     "item",
 *   "indexVariable":    "index"
 * }
 */
@Component
@RequiredArgsConstructor
public class ForeachExecutor implements NodeExecutor {

    private static final String LOOP_PORT = "loop";

    private final ScriptSandbox sandbox;

    @Override
    public NodeType supportedType() {
        return NodeType.FOREACH;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        String sourceExpression = config.text("sourceExpression", "inp._result");
        String itemVariable = config.text("itemVariable", "item");
        String indexVariable = config.text("indexVariable", "index");

        List<?> items = source(sourceExpression, input, ctx);
        ctx.getApi().log().info("Foreach: Iterating over " + items.size() + " items");

        List<AutomateEdge> loopEdges = ctx.getGraph().outgoing(node.getId(), LOOP_PORT);
        for (int i = 0; i < items.size(); i++) {
            if (ctx.isAborted()) break;
            Object item = items.get(i);
            ctx.getVariables().put(itemVariable, item);
            ctx.getVariables().put(indexVariable, i);

            Map<String, Object> bodyInput = new LinkedHashMap<>(input);
            bodyInput.put("_result", item);
            bodyInput.put(itemVariable, item);
            bodyInput.put(indexVariable, i);
            ctx.runBranches(loopEdges, bodyInput);
        }
        return NodeOutcome.next(items.size(), ForLoopExecutor.DONE_PORT);
    }

    private List<?> source(String expression, Map<String, Object> input, ExecutionContext ctx) {
        try {
            Object evaluated = sandbox.evaluate(expression, ctx.getApi(), input, ctx.getVariables());
            if (!(evaluated instanceof List<?> list)) {
                throw new NodeExecutionException("Foreach source is not an array: " + typeOf(evaluated));
            }
            return list;
        } catch (RuntimeException ex) {
            throw new NodeExecutionException("Foreach: Failed to evaluate source expression: " + ex.getMessage(), ex);
        }
    }

    private static String typeOf(Object value) {
        if (value == null) return "undefined";
        if (value instanceof String) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        return "object";
    }
}
