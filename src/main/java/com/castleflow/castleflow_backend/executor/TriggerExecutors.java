package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/*
 * Trigger nodes turn whatever started the run into the node result. They do not
 * start runs themselves; the service layer enters the flow at them.
 */

@Component
@RequiredArgsConstructor
class ManualTriggerExecutor implements NodeExecutor {

    private final ScriptSandbox sandbox;
    private final ObjectMapper objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.MANUAL_TRIGGER;
    }

    /*
     * Config shape:
     * {
     *   "useScript": false,
     *   "payload":   "{ \"city\": \"Gdansk\" }"   // JSON text; kept as a string when it does not parse
     * }
     */
    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        if (config.flag("useScript") && node.getScript() != null && !node.getScript().isBlank()) {
            return NodeOutcome.next(sandbox.execute(node.getScript(), ctx.getApi(), input, ctx.getVariables()));
        }
        Object payload = config.raw("payload");
        if (payload != null && !(payload instanceof String)) {
            return NodeOutcome.next(payload);
        }
        String text = config.text("payload", "{}");
        try {
            return NodeOutcome.next(objectMapper.readValue(text, Object.class));
        } catch (JsonProcessingException ex) {
            return NodeOutcome.next(text);
        }
    }
}

@Component
class WebhookTriggerExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.WEBHOOK_TRIGGER;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("payload", input.get("_webhookPayload"));
        request.put("method", input.get("_webhookMethod"));
        request.put("headers", input.get("_webhookHeaders"));
        request.put("query", input.get("_webhookQuery"));
        return NodeOutcome.next(request);
    }
}

@Component
class ScheduleTriggerExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.SCHEDULE_TRIGGER;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        Map<String, Object> schedule = new LinkedHashMap<>();
        schedule.put("scheduledTime", input.get("_scheduledTime"));
        schedule.put("cronExpression", input.get("_cronExpression"));
        schedule.put("timezone", input.get("_timezone"));
        schedule.put("scheduleNodeId", input.get("_scheduleNodeId"));
        return NodeOutcome.next(schedule);
    }
}
