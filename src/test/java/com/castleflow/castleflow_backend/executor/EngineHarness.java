package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.api.BackendSystemApi;
import com.castleflow.castleflow_backend.api.SpeechClient;
import com.castleflow.castleflow_backend.api.SystemApi;
import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.castleflow.castleflow_backend.engine.FlowExecutionEngine;
import com.castleflow.castleflow_backend.engine.InMemoryRateLimiter;
import com.castleflow.castleflow_backend.engine.RateLimiter;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.executor.impl.CallFlowExecutor;
import com.castleflow.castleflow_backend.executor.impl.LlmCallExecutor;
import com.castleflow.castleflow_backend.executor.impl.NotificationExecutor;
import com.castleflow.castleflow_backend.executor.impl.ScriptExecutor;
import com.castleflow.castleflow_backend.executor.impl.SttExecutor;
import com.castleflow.castleflow_backend.executor.impl.SystemApiExecutor;
import com.castleflow.castleflow_backend.executor.impl.TtsExecutor;
import com.castleflow.castleflow_backend.executor.llm.AiChatClient;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.support.InMemoryFlowRepository;
import com.castleflow.castleflow_backend.support.TestPolyglot;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

/**
 * A fully wired engine without Spring: every executor, an in-memory flow repository,
 * and a facade factory whose AI and speech collaborators tests can swap.
 */
public final class EngineHarness {

    private final AutomateProperties properties = new AutomateProperties();
    private final InMemoryFlowRepository flows = new InMemoryFlowRepository();
    private final FlowExecutionEngine engine;
    private final ScriptSandbox sandbox;
    private AiChatClient aiClient;
    private SpeechClient speechClient;

    private EngineHarness(Consumer<AutomateProperties> customizer, RateLimiter rateLimiter) {
        customizer.accept(properties);
        ObjectMapper objectMapper = new ObjectMapper();
        sandbox = new ScriptSandbox(TestPolyglot.ENGINE, objectMapper, properties);

        NodeExecutorRegistry registry = new NodeExecutorRegistry(List.of(
                new StartExecutor(),
                new ManualTriggerExecutor(sandbox, objectMapper),
                new WebhookTriggerExecutor(),
                new ScheduleTriggerExecutor(),
                new ScriptExecutor(sandbox),
                new SystemApiExecutor(),
                new IfElseExecutor(sandbox),
                new SwitchExecutor(sandbox),
                new ForLoopExecutor(),
                new WhileLoopExecutor(sandbox),
                new ForeachExecutor(sandbox),
                new MergeExecutor(),
                new ReadVariableExecutor(),
                new WriteVariableExecutor(),
                new LogExecutor(objectMapper),
                new NotificationExecutor(),
                new LlmCallExecutor(sandbox),
                new TtsExecutor(sandbox),
                new SttExecutor(),
                new CallFlowExecutor(flows, properties),
                new RateLimitExecutor(rateLimiter),
                new CommentExecutor()));
        registry.init();
        engine = new FlowExecutionEngine(registry, properties);
    }

    public static EngineHarness standard() {
        return new EngineHarness(p -> { }, new InMemoryRateLimiter(Clock.systemUTC()));
    }

    public static EngineHarness with(Consumer<AutomateProperties> customizer) {
        return new EngineHarness(customizer, new InMemoryRateLimiter(Clock.systemUTC()));
    }

    public static EngineHarness with(RateLimiter rateLimiter) {
        return new EngineHarness(p -> { }, rateLimiter);
    }

    public EngineHarness ai(AiChatClient client) {
        this.aiClient = client;
        return this;
    }

    public EngineHarness speech(SpeechClient client) {
        this.speechClient = client;
        return this;
    }

    public SystemApi newApi() {
        return new BackendSystemApi(aiClient, speechClient, Clock.systemUTC());
    }

    public ExecutionResult run(AutomateFlow flow) {
        return engine.executeFlow(flow, newApi());
    }

    public FlowExecutionEngine engine() {
        return engine;
    }

    public InMemoryFlowRepository flows() {
        return flows;
    }

    public ScriptSandbox sandbox() {
        return sandbox;
    }
}
