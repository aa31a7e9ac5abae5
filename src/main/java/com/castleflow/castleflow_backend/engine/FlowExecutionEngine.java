package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.api.SystemApi;
import com.castleflow.castleflow_backend.config.AutomateProperties;
import com.castleflow.castleflow_backend.executor.NodeExecutorRegistry;
import com.castleflow.castleflow_backend.model.domain.AutomateEdge;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.domain.VariableDefinition;
import com.castleflow.castleflow_backend.model.execution.ExecutionLogEntry;
import com.castleflow.castleflow_backend.model.execution.ExecutionResult;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import com.castleflow.castleflow_backend.model.execution.WebhookRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Interprets a flow graph depth-first from its start nodes.
 * <p>
 * A node's output is pushed along every enabled edge of its active port, in edge order,
 * before the next sibling edge is followed. Loop nodes drive their body edges themselves
 * and only continue on {@code done} afterwards. A node failure is routed through the node's
 * {@code error} port when it has one, otherwise it unwinds to the caller and fails the run.
 * <p>
 * Runs on the caller's thread. Edges are driven from an explicit work stack, so a long
 * chain or a cycle costs no Java stack; only loop bodies and subflows nest.
 */
@Slf4j
@Service
public class FlowExecutionEngine {

    public static final String ERROR_PORT = "error";
    private static final int STACK_TRACE_LINES = 8;

    private final NodeExecutorRegistry executorRegistry;
    private final AutomateProperties properties;

    // executionId -> abort signal of every top-level run in flight
    private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

    public FlowExecutionEngine(NodeExecutorRegistry executorRegistry, AutomateProperties properties) {
        this.executorRegistry = executorRegistry;
        this.properties = properties;
    }

    // ── Entry points ────────────────────────────────────────────────────────────

    public ExecutionResult executeFlow(AutomateFlow flow, SystemApi api) {
        return executeFlow(flow, api, Map.of(), List.of());
    }

    public ExecutionResult executeFlow(AutomateFlow flow, SystemApi api,
                                       Map<String, Object> initialInput, List<String> parentCallStack) {
        return executeFlow(flow, api, initialInput, parentCallStack, ExecutionListener.NONE, newExecutionId());
    }

    public ExecutionResult executeFlow(AutomateFlow flow, SystemApi api,
                                       Map<String, Object> initialInput, List<String> parentCallStack,
                                       ExecutionListener listener, String executionId) {
        AtomicBoolean abortSignal = register(executionId);
        try {
            log.info("Executing flow '{}' ({}) executionId={}", flow.displayName(), flow.getId(), executionId);
            ExecutionResult result = run(flow, api, initialInput, parentCallStack, listener, executionId, abortSignal);
            logFinished(flow, executionId, result);
            return result;
        } finally {
            activeRuns.remove(executionId, abortSignal);
        }
    }

    // No call-stack guards apply
    public ExecutionResult executeFromNode(AutomateFlow flow, SystemApi api, String nodeId) {
        return executeFromNode(flow, api, nodeId, ExecutionListener.NONE, newExecutionId());
    }

    public ExecutionResult executeFromNode(AutomateFlow flow, SystemApi api, String nodeId,
                                           ExecutionListener listener, String executionId) {
        AtomicBoolean abortSignal = register(executionId);
        try {
            ExecutionContext ctx = newContext(flow, api, Map.of(), List.of(flow.getId()), listener, executionId, abortSignal);
            AutomateNode entry = ctx.getGraph().node(nodeId).orElse(null);
            if (entry == null) {
                return ExecutionResult.rejected("Node not found: " + nodeId, api.logs(), api.notifications());
            }
            log.info("Executing flow '{}' from node {} executionId={}", flow.displayName(), nodeId, executionId);
            ExecutionResult result = traverse(ctx, List.of(entry), new LinkedHashMap<>());
            logFinished(flow, executionId, result);
            return result;
        } finally {
            activeRuns.remove(executionId, abortSignal);
        }
    }

    public ExecutionResult executeFromWebhook(AutomateFlow flow, SystemApi api, String nodeId,
                                              WebhookRequest request, ExecutionListener listener, String executionId) {
        AtomicBoolean abortSignal = register(executionId);
        try {
            ExecutionContext ctx = newContext(flow, api, Map.of(), List.of(flow.getId()), listener, executionId, abortSignal);
            AutomateNode entry = ctx.getGraph().node(nodeId).orElse(null);
            if (entry == null) {
                return ExecutionResult.rejected("Webhook node not found: " + nodeId, api.logs(), api.notifications());
            }
            if (entry.getNodeType() != NodeType.WEBHOOK_TRIGGER) {
                return ExecutionResult.rejected("Node " + nodeId + " is not a webhook_trigger", api.logs(), api.notifications());
            }
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("_webhookPayload", request.payload());
            input.put("_webhookMethod", request.method());
            input.put("_webhookHeaders", request.headers());
            input.put("_webhookQuery", request.query());

            log.info("Webhook {} {} triggered flow '{}' executionId={}",
                    request.method(), nodeId, flow.displayName(), executionId);
            ExecutionResult result = traverse(ctx, List.of(entry), input);
            logFinished(flow, executionId, result);
            return result;
        } finally {
            activeRuns.remove(executionId, abortSignal);
        }
    }

    // Returns how many runs were signalled
    public int abort() {
        activeRuns.values().forEach(signal -> signal.set(true));
        log.info("Abort requested for {} running execution(s)", activeRuns.size());
        return activeRuns.size();
    }

    public boolean abort(String executionId) {
        AtomicBoolean signal = activeRuns.get(executionId);
        if (signal == null) {
            return false;
        }
        signal.set(true);
        log.info("Abort requested for execution {}", executionId);
        return true;
    }

    public boolean isRunning(String executionId) {
        return activeRuns.containsKey(executionId);
    }

    // ── Traversal ───────────────────────────────────────────────────────────────

    ExecutionResult executeSubflow(ExecutionContext parent, AutomateFlow subflow, Map<String, Object> input) {
        return run(subflow, parent.getApi(), input, parent.getCallStack(),
                parent.getListener(), parent.getExecutionId(), parent.getAbortSignal());
    }

    private ExecutionResult run(AutomateFlow flow, SystemApi api, Map<String, Object> initialInput,
                                List<String> parentCallStack, ExecutionListener listener,
                                String executionId, AtomicBoolean abortSignal) {
        List<String> callStack = parentCallStack != null ? parentCallStack : List.of();
        int maxCallDepth = properties.getEngine().getMaxCallDepth();

        if (callStack.contains(flow.getId())) {
            return ExecutionResult.rejected(
                    "Recursive flow call detected: " + flow.getId() + " (" + flow.getName() + ")",
                    api.logs(), api.notifications());
        }
        if (callStack.size() >= maxCallDepth) {
            return ExecutionResult.rejected(
                    "Max subflow depth (" + maxCallDepth + ") exceeded", api.logs(), api.notifications());
        }

        List<String> ownStack = new ArrayList<>(callStack);
        ownStack.add(flow.getId());
        Map<String, Object> input = initialInput != null ? initialInput : Map.of();
        ExecutionContext ctx = newContext(flow, api, input, ownStack, listener, executionId, abortSignal);

        List<AutomateNode> startNodes = ctx.getGraph().startNodes();
        if (startNodes.isEmpty()) {
            return ExecutionResult.rejected("No start node found", api.logs(), api.notifications());
        }
        return traverse(ctx, startNodes, new LinkedHashMap<>(input));
    }

    private ExecutionResult traverse(ExecutionContext ctx, List<AutomateNode> entryNodes, Map<String, Object> input) {
        try {
            for (AutomateNode entry : entryNodes) {
                if (ctx.isAborted()) break;
                Continuation next = executeNode(ctx, entry, new LinkedHashMap<>(input));
                if (next != null) {
                    runEdges(ctx, next.edges(), next.input());
                }
            }
            return result(ctx, null);
        } catch (StackOverflowError error) {
            log.error("Flow '{}' overflowed the stack after {} node(s)",
                    ctx.getFlow().displayName(), ctx.getNodeExecutions());
            return result(ctx, "Flow graph is too deep to execute (stack overflow after "
                    + ctx.getNodeExecutions() + " nodes)");
        } catch (RuntimeException ex) {
            return result(ctx, messageOf(ex));
        }
    }

    // Outgoing edges go on top of the stack, so a subtree finishes before its next sibling
    void runEdges(ExecutionContext ctx, List<AutomateEdge> edges, Map<String, Object> input) {
        Deque<PendingEdge> pending = new ArrayDeque<>();
        push(pending, edges, input);
        while (!pending.isEmpty()) {
            if (ctx.isAborted()) return;
            PendingEdge current = pending.pop();
            AutomateNode target = ctx.getGraph().node(current.edge().getTargetNodeId()).orElse(null);
            if (target == null) continue;

            Map<String, Object> nodeInput = new LinkedHashMap<>(current.input());
            nodeInput.put("_incomingPortId", current.edge().getTargetPortId());
            Continuation next = executeNode(ctx, target, nodeInput);
            if (next != null) {
                push(pending, next.edges(), next.input());
            }
        }
    }

    // Returns the edges to continue on, or null when the branch ends here
    private Continuation executeNode(ExecutionContext ctx, AutomateNode node, Map<String, Object> input) {
        if (ctx.isAborted() || node.isDisabled()) return null;

        int maxNodeExecutions = properties.getEngine().getMaxNodeExecutions();
        if (ctx.incrementNodeExecutions() > maxNodeExecutions) {
            throw new FatalExecutionException("Flow execution limit exceeded (" + maxNodeExecutions
                    + " nodes). Possible cycle detected.");
        }

        ExecutionListener listener = ctx.getListener();
        ExecutionLogEntry entry = ExecutionLogEntry.running(node, System.currentTimeMillis());
        ctx.getExecutionLog().add(entry);
        listener.onNodeStart(node.getId());
        listener.onLog(entry);

        NodeOutcome outcome;
        try {
            outcome = executorRegistry.get(node.getNodeType()).execute(node, input, ctx);
        } catch (FatalExecutionException ex) {
            markFailed(ctx, node, entry, ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            String message = messageOf(ex);
            markFailed(ctx, node, entry, message);

            List<AutomateEdge> errorEdges = ctx.getGraph().outgoing(node.getId(), ERROR_PORT);
            if (errorEdges.isEmpty()) {
                throw ex;
            }
            log.debug("Node {} ({}) failed, continuing on error port: {}", node.getId(), node.getNodeType(), message);
            Map<String, Object> errorPayload = errorPayload(ex, message, node, input);
            Map<String, Object> next = new LinkedHashMap<>(input);
            next.put("_result", errorPayload);
            next.put("_error", errorPayload);
            return new Continuation(errorEdges, next);
        }

        if (outcome == null) {
            outcome = NodeOutcome.next(null);
        }
        entry.complete(outcome.result(), System.currentTimeMillis());
        listener.onNodeComplete(node.getId(), outcome.result());
        listener.onLog(entry);

        if (outcome.activePort() == null) {
            return null;
        }
        Map<String, Object> next = new LinkedHashMap<>(input);
        next.put("_result", outcome.result());
        return new Continuation(ctx.getGraph().outgoing(node.getId(), outcome.activePort()), next);
    }

    private static void push(Deque<PendingEdge> pending, List<AutomateEdge> edges, Map<String, Object> input) {
        for (int i = edges.size() - 1; i >= 0; i--) {
            pending.push(new PendingEdge(edges.get(i), input));
        }
    }

    private record PendingEdge(AutomateEdge edge, Map<String, Object> input) {
    }

    private record Continuation(List<AutomateEdge> edges, Map<String, Object> input) {
    }

    // ── Helpers ─────────────────────────────────────────────────────────────────

    private ExecutionContext newContext(AutomateFlow flow, SystemApi api, Map<String, Object> input,
                                        List<String> callStack, ExecutionListener listener,
                                        String executionId, AtomicBoolean abortSignal) {
        ExecutionContext ctx = new ExecutionContext(this, executionId, flow, api, callStack, listener, abortSignal);
        if (flow.getVariables() != null) {
            for (VariableDefinition variable : flow.getVariables()) {
                ctx.getVariables().put(variable.getName(), variable.getDefaultValue());
            }
        }
        ctx.getVariables().putAll(input);
        return ctx;
    }

    private void markFailed(ExecutionContext ctx, AutomateNode node, ExecutionLogEntry entry, String message) {
        entry.fail(message, System.currentTimeMillis());
        ctx.getListener().onNodeError(node.getId(), message);
        ctx.getListener().onLog(entry);
    }

    private ExecutionResult result(ExecutionContext ctx, String error) {
        return ExecutionResult.builder()
                .success(error == null)
                .executionLog(new ArrayList<>(ctx.getExecutionLog()))
                .logs(new ArrayList<>(ctx.getApi().logs()))
                .notifications(new ArrayList<>(ctx.getApi().notifications()))
                .variables(new LinkedHashMap<>(ctx.getVariables()))
                .error(error)
                .build();
    }

    private Map<String, Object> errorPayload(Exception ex, String message, AutomateNode node, Map<String, Object> input) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("stack", stackTraceOf(ex));
        payload.put("nodeId", node.getId());
        payload.put("nodeName", node.getName());
        payload.put("nodeType", node.getNodeType() != null ? node.getNodeType().getKey() : null);
        payload.put("timestamp", System.currentTimeMillis());
        payload.put("input", input);
        return payload;
    }

    private AtomicBoolean register(String executionId) {
        AtomicBoolean signal = new AtomicBoolean(false);
        activeRuns.put(executionId, signal);
        return signal;
    }

    private void logFinished(AutomateFlow flow, String executionId, ExecutionResult result) {
        if (result.isSuccess()) {
            log.info("Flow '{}' finished executionId={} nodes={}", flow.displayName(), executionId,
                    result.getExecutionLog().size());
        } else {
            log.warn("Flow '{}' failed executionId={}: {}", flow.displayName(), executionId, result.getError());
        }
    }

    private static String newExecutionId() {
        return UUID.randomUUID().toString();
    }

    static String messageOf(Throwable ex) {
        String message = ex.getMessage();
        return message != null && !message.isBlank() ? message : ex.getClass().getSimpleName();
    }

    private static String stackTraceOf(Throwable ex) {
        StringWriter writer = new StringWriter();
        ex.printStackTrace(new PrintWriter(writer));
        String[] lines = writer.toString().split("\\R");
        return String.join("\n", Arrays.copyOf(lines, Math.min(lines.length, STACK_TRACE_LINES)));
    }
}
