package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.model.domain.AutomateEdge;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the {@code body} port {@code count} times, then continues on {@code done}
 * with the count as result.
 *
 * Config shape:
 * {
 *   "count":         5,
 *   "indexVariable": "i"     // flow variable holding the current index
 * }
 */
@Component
public class ForLoopExecutor implements NodeExecutor {

    static final String BODY_PORT = "body";
    static final String DONE_PORT = "done";

    @Override
    public NodeType supportedType() {
        return NodeType.FOR_LOOP;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        int count = config.integer("count", 0);
        String indexVariable = config.text("indexVariable", "i");
        List<AutomateEdge> body = ctx.getGraph().outgoing(node.getId(), BODY_PORT);

        for (int i = 0; i < count; i++) {
            if (ctx.isAborted()) break;
            ctx.getVariables().put(indexVariable, i);
            Map<String, Object> bodyInput = new LinkedHashMap<>(input);
            bodyInput.put("index", i);
            ctx.runBranches(body, bodyInput);
        }
        return NodeOutcome.next(count, DONE_PORT);
    }
}
