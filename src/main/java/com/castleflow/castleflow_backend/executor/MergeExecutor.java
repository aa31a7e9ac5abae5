package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Barrier over the node's connected input ports. Every arrival records its value under
 * the port it came in on; once each deliverable port has delivered, the node fires once
 * with all values and its barrier starts over.
 * <p>
 * {@code mode = object} (default) yields {port: value}; {@code mode = array} yields the
 * values in order of first arrival.
 */
@Component
public class MergeExecutor implements NodeExecutor {

    private static final String DEFAULT_PORT = "in_1";

    @Override
    public NodeType supportedType() {
        return NodeType.MERGE;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        Object incoming = input.get("_incomingPortId");
        String port = incoming instanceof String s && !s.isBlank() ? s : DEFAULT_PORT;

        LinkedHashMap<String, Object> arrived = ctx.mergeBarrier(node.getId());
        arrived.put(port, input.get("_result"));

        Set<String> expected = ctx.getGraph().deliverableInputPorts(node.getId());
        if (!arrived.keySet().containsAll(expected)) {
            Map<String, Object> waiting = new LinkedHashMap<>();
            waiting.put("waiting", true);
            waiting.put("received", new ArrayList<>(arrived.keySet()));
            return NodeOutcome.halt(waiting);
        }

        Object merged = "array".equals(NodeConfig.of(node).text("mode"))
                ? new ArrayList<>(arrived.values())
                : new LinkedHashMap<>(arrived);
        ctx.clearMergeBarrier(node.getId());
        return NodeOutcome.next(merged);
    }
}
