package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.api.ChatOptions;
import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.executor.NodeConfig;
import com.castleflow.castleflow_backend.executor.NodeExecutor;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sends a prompt through {@code api.ai.chat} and passes the completion text on.
 *
 * Config shape:
 * {
 *   "prompt":       "Summarise: ...",     // or useScript + script returning the prompt
 *   "systemPrompt": "You are terse.",
 *   "model":        "gpt-4o-mini",
 *   "temperature":  0.2,
 *   "maxTokens":    256
 * }
 *
 * An empty prompt skips the call and yields {@code null}.
 */
@Component
@RequiredArgsConstructor
public class LlmCallExecutor implements NodeExecutor {

    private final ScriptSandbox sandbox;

    @Override
    public NodeType supportedType() {
        return NodeType.LLM_CALL;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        String prompt = ScriptedText.resolve(node, "prompt", sandbox, input, ctx);
        if (prompt.isEmpty()) {
            return NodeOutcome.next(null);
        }

        NodeConfig config = NodeConfig.of(node);
        ChatOptions options = new ChatOptions(
                config.text("systemPrompt"),
                config.text("model"),
                config.decimal("temperature"),
                config.optionalInteger("maxTokens"));
        String response = ctx.getApi().ai().chat(prompt, options);

        ctx.getApi().log().info("LLM response (" + truncate(prompt, 50) + "...): " + truncate(String.valueOf(response), 200));
        return NodeOutcome.next(response);
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }
}
