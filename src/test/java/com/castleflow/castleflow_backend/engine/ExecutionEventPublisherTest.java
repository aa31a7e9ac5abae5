package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ExecutionEventPublisherTest {

    private final SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
    private final ExecutionEventPublisher publisher = new ExecutionEventPublisher(template);

    @Test
    void publishesNodeProgressToExecutionTopic() {
        ExecutionListener listener = publisher.listenerFor("exec-9");

        listener.onNodeStart("n1");
        listener.onNodeComplete("n1", "ignored");
        listener.onNodeError("n2", "boom");

        verify(template).convertAndSend("/topic/execution/exec-9", (Object) Map.of("nodeId", "n1", "status", "running", "error", ""));
        verify(template).convertAndSend("/topic/execution/exec-9", (Object) Map.of("nodeId", "n1", "status", "completed", "error", ""));
        verify(template).convertAndSend("/topic/execution/exec-9", (Object) Map.of("nodeId", "n2", "status", "error", "error", "boom"));
    }

    @Test
    void publishesRunOutcome() {
        publisher.executionFinished("exec-9", ExecutionResult.rejected("No start node found", List.of(), List.of()));

        verify(template).convertAndSend("/topic/execution/exec-9",
                (Object) Map.of("nodeId", "", "status", "failure", "error", "No start node found"));
    }

    @Test
    void brokerFailureDoesNotReachTheRun() {
        doThrow(new MessageDeliveryException("broker down")).when(template).convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> publisher.listenerFor("exec-9").onNodeStart("n1")).doesNotThrowAnyException();
    }
}
