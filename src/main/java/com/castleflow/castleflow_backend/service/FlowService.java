package com.castleflow.castleflow_backend.service;

import com.castleflow.castleflow_backend.api.SystemApi;
import com.castleflow.castleflow_backend.api.SystemApiFactory;
import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.castleflow.castleflow_backend.engine.ExecutionEventPublisher;
import com.castleflow.castleflow_backend.engine.ExecutionListener;
import com.castleflow.castleflow_backend.engine.FlowExecutionEngine;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.FlowRuntime;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.model.execution.WebhookRequest;
import com.castleflow.castleflow_backend.repository.FlowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Entry point for runs started over HTTP. Resolves the flow, checks that its nodes can run
 * on this engine, and executes it on a worker thread with an enlarged stack while the
 * calling request thread waits for the result.
 */
@Slf4j
@Service
public class FlowService {

    private final FlowRepository flowRepository;
    private final FlowExecutionEngine engine;
    private final SystemApiFactory systemApiFactory;
    private final ExecutionEventPublisher eventPublisher;
    private final ExecutorService automateExecutor;
    private final AutomateProperties properties;

    public FlowService(FlowRepository flowRepository,
                       FlowExecutionEngine engine,
                       SystemApiFactory systemApiFactory,
                       ExecutionEventPublisher eventPublisher,
                       @Qualifier("automateExecutor") ExecutorService automateExecutor,
                       AutomateProperties properties) {
        this.flowRepository = flowRepository;
        this.engine = engine;
        this.systemApiFactory = systemApiFactory;
        this.eventPublisher = eventPublisher;
        this.automateExecutor = automateExecutor;
        this.properties = properties;
    }

    public List<AutomateFlow> listFlows() {
        return flowRepository.findAll();
    }

    public AutomateFlow getFlow(String flowId) {
        return flowRepository.findById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
    }

    public int reloadFlows() {
        return flowRepository.reload();
    }

    public ExecutionResult executeFlow(String flowId, Map<String, Object> input, String executionId) {
        AutomateFlow flow = getFlow(flowId);
        return run(flow, executionId, (api, listener) ->
                engine.executeFlow(flow, api, input != null ? input : Map.of(), List.of(), listener, executionId));
    }

    public ExecutionResult executeFromNode(String flowId, String nodeId, String executionId) {
        AutomateFlow flow = getFlow(flowId);
        return run(flow, executionId, (api, listener) ->
                engine.executeFromNode(flow, api, nodeId, listener, executionId));
    }

    public ExecutionResult executeWebhook(String flowId, String nodeId, WebhookRequest request, String executionId) {
        AutomateFlow flow = getFlow(flowId);
        return run(flow, executionId, (api, listener) ->
                engine.executeFromWebhook(flow, api, nodeId, request, listener, executionId));
    }

    public int abortAll() {
        return engine.abort();
    }

    public boolean abort(String executionId) {
        return engine.abort(executionId);
    }

    public static String newExecutionId() {
        return UUID.randomUUID().toString();
    }

    // ── Helpers ─────────────────────────────────────────────────────────────────

    private ExecutionResult run(AutomateFlow flow, String executionId,
                                BiFunction<SystemApi, ExecutionListener, ExecutionResult> execution) {
        SystemApi api = systemApiFactory.create();
        ExecutionResult result = checkRuntime(flow, api);
        if (result == null) {
            ExecutionListener listener = eventPublisher.listenerFor(executionId);
            result = onWorker(executionId, () -> execution.apply(api, listener), api);
        }
        eventPublisher.executionFinished(executionId, result);
        return result;
    }

    private ExecutionResult checkRuntime(AutomateFlow flow, SystemApi api) {
        FlowRuntime engineRuntime = properties.getEngine().getRuntime();
        List<AutomateNode> incompatible = flow.getNodes() == null ? List.of() : flow.getNodes().stream()
                .filter(n -> !n.isDisabled() && n.getNodeType() != null)
                .filter(n -> !n.getNodeType().getRuntime().isCompatibleWith(engineRuntime))
                .toList();
        if (incompatible.isEmpty()) {
            return null;
        }
        String names = incompatible.stream()
                .map(n -> n.getName() + " (" + n.getNodeType().getKey() + ")")
                .collect(Collectors.joining(", "));
        log.warn("Flow '{}' rejected on {} runtime: {}", flow.displayName(), engineRuntime.getKey(), names);
        return ExecutionResult.rejected("Flow contains nodes that cannot run on " + engineRuntime.getKey()
                + ": " + names, api.logs(), api.notifications());
    }

    private ExecutionResult onWorker(String executionId, Callable<ExecutionResult> task, SystemApi api) {
        Future<ExecutionResult> future = automateExecutor.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            engine.abort(executionId);
            return ExecutionResult.rejected("Execution interrupted", api.logs(), api.notifications());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Execution {} failed outside the engine", executionId, cause);
            String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return ExecutionResult.rejected(msg, api.logs(), api.notifications());
        }
    }
}
