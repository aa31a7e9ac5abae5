package com.castleflow.castleflow_backend.model.execution;

import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One node activation. Created as {@code running} when the node is entered and
 * settled exactly once, either to {@code completed} with a result or to {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionLogEntry {

    private String nodeId;
    private String nodeName;
    private String nodeType;
    private NodeStatus status;
    private long startTime;
    private Long endTime;
    private Object result;
    private String error;

    public static ExecutionLogEntry running(AutomateNode node, long now) {
        return ExecutionLogEntry.builder()
                .nodeId(node.getId())
                .nodeName(node.getName())
                .nodeType(node.getNodeType() != null ? node.getNodeType().getKey() : null)
                .status(NodeStatus.RUNNING)
                .startTime(now)
                .build();
    }

    public void complete(Object result, long now) {
        this.status = NodeStatus.COMPLETED;
        this.result = result;
        this.endTime = now;
    }

    public void fail(String error, long now) {
        this.status = NodeStatus.ERROR;
        this.error = error;
        this.endTime = now;
    }
}
