package com.castleflow.castleflow_backend.controller;

import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.service.FlowService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/flows")
@RequiredArgsConstructor
public class FlowController {

    private final FlowService flowService;

    public record FlowSummary(String id, String name, String description, String runtime, int nodeCount) {}

    @GetMapping
    public List<FlowSummary> list() {
        return flowService.listFlows().stream()
                .map(f -> new FlowSummary(
                        f.getId(),
                        f.getName(),
                        f.getDescription(),
                        f.effectiveRuntime().getKey(),
                        f.getNodes() != null ? f.getNodes().size() : 0))
                .toList();
    }

    @GetMapping("/{flowId}")
    public AutomateFlow get(@PathVariable String flowId) {
        return flowService.getFlow(flowId);
    }

    @PostMapping("/reload")
    public Map<String, Object> reload() {
        return Map.of("loaded", flowService.reloadFlows());
    }

    /**
     * Runs the flow and waits for the result. Body entries become initial variables.
     * Pass {@code executionId} to pick the WebSocket topic in advance.
     */
    @PostMapping("/{flowId}/execute")
    public ExecutionResult execute(@PathVariable String flowId,
                                   @RequestParam(required = false) String executionId,
                                   @RequestBody(required = false) Map<String, Object> input) {
        return flowService.executeFlow(flowId, input, executionIdOrNew(executionId));
    }

    @PostMapping("/{flowId}/nodes/{nodeId}/execute")
    public ExecutionResult executeFromNode(@PathVariable String flowId,
                                           @PathVariable String nodeId,
                                           @RequestParam(required = false) String executionId) {
        return flowService.executeFromNode(flowId, nodeId, executionIdOrNew(executionId));
    }

    private static String executionIdOrNew(String executionId) {
        return executionId != null && !executionId.isBlank() ? executionId : FlowService.newExecutionId();
    }
}
