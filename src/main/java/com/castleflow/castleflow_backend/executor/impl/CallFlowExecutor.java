package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.NodeExecutionException;
import com.castleflow.castleflow_backend.executor.NodeConfig;
import com.castleflow.castleflow_backend.executor.NodeExecutor;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.FlowRuntime;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import com.castleflow.castleflow_backend.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs another flow inline and passes its final variables on as the result.
 *
 * Config shape:
 * {
 *   "flowId":             "flow_weather",
 *   "passInputAsPayload": true    // subflow sees the incoming _result as variable _parentInput
 * }
 *
 * The subflow runs on the same thread with its own variables and node budget; it shares
 * the caller's log, notifications, listener and abort signal. Recursion and call depth are
 * checked by the engine when the subflow starts.
 */
@Component
@RequiredArgsConstructor
public class CallFlowExecutor implements NodeExecutor {

    private final FlowRepository flowRepository;
    private final AutomateProperties properties;

    @Override
    public NodeType supportedType() {
        return NodeType.CALL_FLOW;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        String flowId = config.text("flowId");
        if (flowId == null) {
            throw new NodeExecutionException("Call Flow: No flow selected");
        }
        AutomateFlow subflow = flowRepository.findById(flowId)
                .orElseThrow(() -> new NodeExecutionException("Call Flow: Flow not found: " + flowId));

        checkRuntime(subflow);

        Map<String, Object> subflowInput = new LinkedHashMap<>();
        if (config.flagUnlessFalse("passInputAsPayload")) {
            subflowInput.put("_parentInput", input.get("_result"));
        }

        ctx.getApi().log().info("Calling subflow: " + subflow.getName() + " (" + flowId + ")");
        ExecutionResult result = ctx.runSubflow(subflow, subflowInput);
        if (!result.isSuccess()) {
            throw new NodeExecutionException("Subflow \"" + subflow.getName() + "\" failed: " + result.getError());
        }
        ctx.getApi().log().info("Subflow " + subflow.getName() + " completed");
        return NodeOutcome.next(result.getVariables());
    }

    private void checkRuntime(AutomateFlow subflow) {
        FlowRuntime engineRuntime = properties.getEngine().getRuntime();
        if (!subflow.effectiveRuntime().isCompatibleWith(engineRuntime)) {
            throw new NodeExecutionException("Call Flow: Cannot call " + subflow.effectiveRuntime().getKey()
                    + "-only flow \"" + subflow.getName() + "\" from " + engineRuntime.getKey());
        }

        List<AutomateNode> incompatible = subflow.getNodes() == null ? List.of() : subflow.getNodes().stream()
                .filter(n -> !n.isDisabled() && n.getNodeType() != null)
                .filter(n -> !n.getNodeType().getRuntime().isCompatibleWith(engineRuntime))
                .toList();
        if (!incompatible.isEmpty()) {
            String names = incompatible.stream()
                    .map(n -> n.getName() + " (" + n.getNodeType().getKey() + ")")
                    .collect(Collectors.joining(", "));
            throw new NodeExecutionException("Call Flow: Subflow \"" + subflow.getName() + "\" contains "
                    + incompatibleLabel(engineRuntime) + " nodes: " + names);
        }
    }

    private static String incompatibleLabel(FlowRuntime engineRuntime) {
        return engineRuntime == FlowRuntime.BACKEND ? "client-only" : "backend-only";
    }
}
