package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.model.execution.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class ExecutionEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    // The editor subscribes to /topic/execution/{executionId} to receive live updates
    private static final String TOPIC = "/topic/execution/";

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    /** Listener that forwards node progress of one execution to its topic. */
    public ExecutionListener listenerFor(String executionId) {
        return new ExecutionListener() {
            @Override
            public void onNodeStart(String nodeId) {
                publish(executionId, nodeId, NodeStatus.RUNNING.getKey(), null);
            }

            @Override
            public void onNodeComplete(String nodeId, Object result) {
                publish(executionId, nodeId, NodeStatus.COMPLETED.getKey(), null);
            }

            @Override
            public void onNodeError(String nodeId, String error) {
                publish(executionId, nodeId, NodeStatus.ERROR.getKey(), error);
            }
        };
    }

    public void executionFinished(String executionId, ExecutionResult result) {
        publish(executionId, "", result.isSuccess() ? "success" : "failure", result.getError());
    }

    private void publish(String executionId, String nodeId, String status, String error) {
        Map<String, Object> payload = Map.of(
                "nodeId", nodeId,
                "status", status,
                "error",  error != null ? error : ""
        );
        String destination = TOPIC + executionId;
        log.debug("Publishing {} for node {} to {}", status, nodeId, destination);
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (RuntimeException e) {
            // Progress events are best effort; the run itself must not fail because of them
            log.warn("Could not publish execution event to {}: {}", destination, e.getMessage());
        }
    }
}
