package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.NodeExecutionException;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.LogLevel;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes {@code message} at {@code level} through the system API. With {@code logInput}
 * the incoming {@code _result} (or the whole input when there is none) is appended as
 * pretty-printed JSON.
 */
@Component
@RequiredArgsConstructor
public class LogExecutor implements NodeExecutor {

    private final ObjectMapper objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.LOG;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        String message = config.text("message", "");
        LogLevel level = LogLevel.fromKey(config.text("level"));

        if (config.flag("logInput")) {
            Object subject = input.get("_result") != null ? input.get("_result") : input;
            String json;
            try {
                json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(subject);
            } catch (JsonProcessingException ex) {
                throw new NodeExecutionException("Log: input is not serializable: " + ex.getOriginalMessage(), ex);
            }
            message = message.isEmpty() ? json : message + "\n" + json;
        }
        ctx.getApi().log().write(level, message);
        return NodeOutcome.next(null);
    }
}
