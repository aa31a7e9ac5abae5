package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.api.SystemApi;
import com.castleflow.castleflow_backend.model.domain.AutomateEdge;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.execution.ExecutionLogEntry;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one flow instance: the variable scope, the per-node execution log, the
 * merge barriers and the node counter. A subflow gets its own context but shares the
 * facade, the listener and the abort signal with its caller.
 */
@Getter
public class ExecutionContext {

    private final String executionId;
    private final AutomateFlow flow;
    private final FlowGraph graph;
    private final SystemApi api;
    private final List<String> callStack;
    private final ExecutionListener listener;
    private final AtomicBoolean abortSignal;
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final List<ExecutionLogEntry> executionLog = new ArrayList<>();

    private final Map<String, LinkedHashMap<String, Object>> mergeBarriers = new HashMap<>();
    @Getter(AccessLevel.NONE)
    private final FlowExecutionEngine engine;
    private int nodeExecutions;

    ExecutionContext(FlowExecutionEngine engine,
                     String executionId,
                     AutomateFlow flow,
                     SystemApi api,
                     List<String> callStack,
                     ExecutionListener listener,
                     AtomicBoolean abortSignal) {
        this.engine = engine;
        this.executionId = executionId;
        this.flow = flow;
        this.graph = FlowGraph.of(flow);
        this.api = api;
        this.callStack = Collections.unmodifiableList(new ArrayList<>(callStack));
        this.listener = listener != null ? listener : ExecutionListener.NONE;
        this.abortSignal = abortSignal;
    }

    public boolean isAborted() {
        return abortSignal.get();
    }

    int incrementNodeExecutions() {
        return ++nodeExecutions;
    }

    // Keyed by input port in first-arrival order
    public LinkedHashMap<String, Object> mergeBarrier(String nodeId) {
        return mergeBarriers.computeIfAbsent(nodeId, k -> new LinkedHashMap<>());
    }

    public void clearMergeBarrier(String nodeId) {
        mergeBarriers.remove(nodeId);
    }

    public void runBranches(List<AutomateEdge> edges, Map<String, Object> input) {
        engine.runEdges(this, edges, input);
    }

    public ExecutionResult runSubflow(AutomateFlow subflow, Map<String, Object> input) {
        return engine.executeSubflow(this, subflow, input);
    }
}
