package com.castleflow.castleflow_backend.service;

import com.castleflow.castleflow_backend.api.SystemApiFactory;
import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.castleflow.castleflow_backend.engine.ExecutionEventPublisher;
import com.castleflow.castleflow_backend.engine.ExecutionListener;
import com.castleflow.castleflow_backend.executor.EngineHarness;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.model.execution.WebhookRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.castleflow.castleflow_backend.support.TestFlows.disabled;
import static com.castleflow.castleflow_backend.support.TestFlows.edge;
import static com.castleflow.castleflow_backend.support.TestFlows.flow;
import static com.castleflow.castleflow_backend.support.TestFlows.node;
import static com.castleflow.castleflow_backend.support.TestFlows.script;
import static com.castleflow.castleflow_backend.support.TestFlows.start;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FlowServiceTest {

    private final EngineHarness harness = EngineHarness.standard();
    private final SystemApiFactory apiFactory = mock(SystemApiFactory.class);
    private final ExecutionEventPublisher publisher = mock(ExecutionEventPublisher.class);
    private ExecutorService worker;
    private FlowService service;

    @BeforeEach
    void setUp() {
        worker = Executors.newSingleThreadExecutor();
        when(apiFactory.create()).thenAnswer(invocation -> harness.newApi());
        when(publisher.listenerFor(anyString())).thenReturn(ExecutionListener.NONE);
        service = new FlowService(harness.flows(), harness.engine(), apiFactory, publisher, worker, new AutomateProperties());

        harness.flows().save(flow("hello",
                List.of(start(),
                        script("greet", "vars.greeting = 'Hello ' + (vars.name || 'World'); return vars.greeting;"),
                        node("hook", NodeType.WEBHOOK_TRIGGER),
                        script("fromHook", "vars.body = inp._result.payload.text;")),
                List.of(edge("start", "out", "greet"), edge("hook", "out", "fromHook"))));
    }

    @AfterEach
    void tearDown() {
        worker.shutdownNow();
    }

    @Test
    void executesFlowWithInputAndPublishesCompletion() {
        ExecutionResult result = service.executeFlow("hello", Map.of("name", "Ada"), "exec-1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getVariables()).containsEntry("greeting", "Hello Ada");
        verify(publisher).listenerFor("exec-1");
        verify(publisher).executionFinished("exec-1", result);
    }

    @Test
    void nullInputIsTreatedAsEmpty() {
        assertThat(service.executeFlow("hello", null, "exec-2").getVariables()).containsEntry("greeting", "Hello World");
    }

    @Test
    void executesFromSingleNode() {
        ExecutionResult result = service.executeFromNode("hello", "greet", "exec-3");

        assertThat(result.getExecutionLog()).hasSize(1);
        assertThat(result.getVariables()).containsEntry("greeting", "Hello World");
    }

    @Test
    void routesWebhookRequestsToTheTriggerNode() {
        WebhookRequest request = new WebhookRequest(Map.of("text", "ping"), "POST", Map.of(), Map.of());

        ExecutionResult result = service.executeWebhook("hello", "hook", request, "exec-4");

        assertThat(result.getVariables()).containsEntry("body", "ping").doesNotContainKey("greeting");
    }

    @Test
    void unknownFlowIsNotFound() {
        assertThatThrownBy(() -> service.executeFlow("missing", Map.of(), "exec-5"))
                .isInstanceOf(FlowNotFoundException.class)
                .hasMessageContaining("Flow not found: missing");
    }

    @Test
    void rejectsFlowWithClientOnlyNodesBeforeRunning() {
        harness.flows().save(flow("voice",
                List.of(start(), node("Speak", NodeType.TTS), disabled(node("Listen", NodeType.STT))),
                List.of(edge("start", "out", "Speak"))));

        ExecutionResult result = service.executeFlow("voice", Map.of(), "exec-6");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Flow contains nodes that cannot run on backend: Speak (tts)");
        assertThat(result.getExecutionLog()).isEmpty();
        verify(publisher, never()).listenerFor(anyString());
        verify(publisher).executionFinished("exec-6", result);
    }

    @Test
    void abortOfUnknownExecutionReportsFalse() {
        assertThat(service.abort("nothing-running")).isFalse();
        assertThat(service.abortAll()).isZero();
    }

    @Test
    void listsAndReloadsThroughTheRepository() {
        assertThat(service.listFlows()).extracting(AutomateFlow::getId).containsExactly("hello");
        assertThat(service.getFlow("hello").getName()).isEqualTo("Flow hello");
        assertThat(service.reloadFlows()).isEqualTo(1);
    }
}
