package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.executor.EngineHarness;
import com.castleflow.castleflow_backend.model.domain.AutomateEdge;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.FlowRuntime;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.ExecutionLogEntry;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.model.execution.LogEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.castleflow.castleflow_backend.support.TestFlows.edge;
import static com.castleflow.castleflow_backend.support.TestFlows.flow;
import static com.castleflow.castleflow_backend.support.TestFlows.node;
import static com.castleflow.castleflow_backend.support.TestFlows.script;
import static com.castleflow.castleflow_backend.support.TestFlows.start;
import static org.assertj.core.api.Assertions.assertThat;

class CallFlowExecutorTest {

    private final EngineHarness harness = EngineHarness.standard();

    @Test
    void runsSubflowWithParentInputAndReturnsItsVariables() {
        harness.flows().save(flow("sub",
                List.of(start(), script("double", "vars.doubled = vars._parentInput * 2;")),
                List.of(edge("start", "out", "double"))));
        AutomateFlow parent = flow("parent",
                List.of(start(),
                        script("seed", "return 21;"),
                        callFlow("call", "sub"),
                        script("use", "vars.answer = inp._result.doubled;")),
                List.of(edge("start", "out", "seed"),
                        edge("seed", "out", "call"),
                        edge("call", "out", "use")));

        ExecutionResult result = harness.run(parent);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getVariables()).containsEntry("answer", 42).doesNotContainKey("doubled");
        assertThat(result.getLogs()).extracting(LogEntry::message)
                .containsExactly("Calling subflow: Flow sub (sub)", "Subflow Flow sub completed");
        assertThat(result.getExecutionLog()).extracting(ExecutionLogEntry::getNodeId)
                .containsExactly("start", "seed", "call", "use");
    }

    @Test
    void omitsParentInputWhenDisabled() {
        harness.flows().save(flow("sub",
                List.of(start(), script("check", "vars.hasParent = ('_parentInput' in vars);")),
                List.of(edge("start", "out", "check"))));
        AutomateNode call = callFlow("call", "sub");
        call.getConfig().put("passInputAsPayload", false);
        AutomateFlow parent = flow("parent",
                List.of(start(), call, script("use", "vars.hasParent = inp._result.hasParent;")),
                List.of(edge("start", "out", "call"), edge("call", "out", "use")));

        assertThat(harness.run(parent).getVariables()).containsEntry("hasParent", false);
    }

    @Test
    void failsWithoutSelectedFlow() {
        ExecutionResult result = harness.run(single(node("call", NodeType.CALL_FLOW)));

        assertThat(result.getError()).isEqualTo("Call Flow: No flow selected");
    }

    @Test
    void failsForUnknownFlow() {
        ExecutionResult result = harness.run(single(callFlow("call", "ghost")));

        assertThat(result.getError()).isEqualTo("Call Flow: Flow not found: ghost");
    }

    @Test
    void rejectsClientOnlySubflow() {
        harness.flows().save(flow("sub", FlowRuntime.CLIENT, List.of(start()), List.of()));

        ExecutionResult result = harness.run(single(callFlow("call", "sub")));

        assertThat(result.getError()).isEqualTo("Call Flow: Cannot call client-only flow \"Flow sub\" from backend");
    }

    @Test
    void rejectsSubflowWithClientOnlyNodes() {
        harness.flows().save(flow("sub",
                List.of(start(), node("speak", NodeType.TTS), node("listen", NodeType.STT)),
                List.of(edge("start", "out", "speak"))));

        ExecutionResult result = harness.run(single(callFlow("call", "sub")));

        assertThat(result.getError()).isEqualTo(
                "Call Flow: Subflow \"Flow sub\" contains client-only nodes: speak (tts), listen (stt)");
    }

    @Test
    void subflowFailureIsReportedOnTheCallNode() {
        harness.flows().save(flow("sub",
                List.of(start(), script("bad", "throw new Error('inner');")),
                List.of(edge("start", "out", "bad"))));

        ExecutionResult result = harness.run(single(callFlow("call", "sub")));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Subflow \"Flow sub\" failed: inner");
    }

    @Test
    void detectsRecursionThroughCallFlow() {
        AutomateFlow self = flow("loop", List.of(start(), callFlow("again", "loop")), List.of(edge("start", "out", "again")));
        harness.flows().save(self);

        ExecutionResult result = harness.run(self);

        assertThat(result.getError())
                .isEqualTo("Subflow \"Flow loop\" failed: Recursive flow call detected: loop (Flow loop)");
    }

    @Test
    void chainOfTenFlowsRunsButElevenExceedsDepth() {
        saveChain(10);
        assertThat(harness.run(harness.flows().findById("c0").orElseThrow()).isSuccess()).isTrue();

        EngineHarness deeper = EngineHarness.standard();
        saveChain(deeper, 11);
        ExecutionResult result = deeper.run(deeper.flows().findById("c0").orElseThrow());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("Max subflow depth (10) exceeded");
    }

    // ── Helpers ─────────────────────────────────────────────────────────────────

    private static AutomateNode callFlow(String id, String flowId) {
        return node(id, NodeType.CALL_FLOW, Map.of("flowId", flowId));
    }

    private static AutomateFlow single(AutomateNode node) {
        return flow("parent", List.of(start(), node), List.of(edge("start", "out", node.getId())));
    }

    private void saveChain(int length) {
        saveChain(harness, length);
    }

    private static void saveChain(EngineHarness target, int length) {
        for (int i = 0; i < length; i++) {
            List<AutomateNode> nodes = new ArrayList<>(List.of(start()));
            List<AutomateEdge> edges = new ArrayList<>();
            if (i < length - 1) {
                nodes.add(callFlow("next", "c" + (i + 1)));
                edges.add(edge("start", "out", "next"));
            }
            target.flows().save(flow("c" + i, nodes, edges));
        }
    }
}
