package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.model.domain.AutomateEdge;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.ExecutionLogEntry;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.castleflow.castleflow_backend.support.TestFlows.disabled;
import static com.castleflow.castleflow_backend.support.TestFlows.edge;
import static com.castleflow.castleflow_backend.support.TestFlows.flow;
import static com.castleflow.castleflow_backend.support.TestFlows.node;
import static com.castleflow.castleflow_backend.support.TestFlows.script;
import static com.castleflow.castleflow_backend.support.TestFlows.start;
import static org.assertj.core.api.Assertions.assertThat;

class MergeExecutorTest {

    private final EngineHarness harness = EngineHarness.standard();

    @Test
    void waitsForEveryConnectedPortThenFiresOnce() {
        ExecutionResult result = harness.run(mergeFlow(null, script("a", "return 'A';"), script("b", "return 'B';"), false));

        List<ExecutionLogEntry> mergeEntries = entriesOf(result, "merge");
        assertThat(mergeEntries).hasSize(2);
        assertThat(mergeEntries.get(0).getResult()).isEqualTo(Map.of("waiting", true, "received", List.of("in_1")));
        assertThat(mergeEntries.get(1).getResult()).isEqualTo(Map.of("in_1", "A", "in_2", "B"));
        assertThat(entriesOf(result, "after")).hasSize(1);
        assertThat(result.getVariables()).containsEntry("merged", Map.of("in_1", "A", "in_2", "B"));
    }

    @Test
    void arrayModeKeepsArrivalOrder() {
        ExecutionResult result = harness.run(mergeFlow("array", script("a", "return 'A';"), script("b", "return 'B';"), true));

        assertThat(result.getVariables()).containsEntry("merged", List.of("B", "A"));
    }

    @Test
    void disabledSourceDoesNotHoldTheBarrier() {
        ExecutionResult result = harness.run(mergeFlow(null, script("a", "return 'A';"), disabled(script("b", "return 'B';")), false));

        assertThat(entriesOf(result, "merge")).hasSize(1);
        assertThat(result.getVariables()).containsEntry("merged", Map.of("in_1", "A"));
    }

    private static AutomateFlow mergeFlow(String mode, AutomateNode a, AutomateNode b, boolean bFirst) {
        AutomateNode merge = mode != null
                ? node("merge", NodeType.MERGE, Map.of("mode", mode))
                : node("merge", NodeType.MERGE);
        AutomateEdge toA = edge("start", "out", "a");
        AutomateEdge toB = edge("start", "out", "b");
        return flow("f",
                List.of(start(), a, b, merge, script("after", "vars.merged = inp._result;")),
                List.of(bFirst ? toB : toA,
                        bFirst ? toA : toB,
                        edge("a", "out", "merge", "in_1"),
                        edge("b", "out", "merge", "in_2"),
                        edge("merge", "out", "after")));
    }

    private static List<ExecutionLogEntry> entriesOf(ExecutionResult result, String nodeId) {
        return result.getExecutionLog().stream().filter(e -> e.getNodeId().equals(nodeId)).toList();
    }
}
