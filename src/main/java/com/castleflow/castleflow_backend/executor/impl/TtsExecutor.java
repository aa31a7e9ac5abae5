package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.api.SpeechOptions;
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

@Component
@RequiredArgsConstructor
public class TtsExecutor implements NodeExecutor {

    private final ScriptSandbox sandbox;

    @Override
    public NodeType supportedType() {
        return NodeType.TTS;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        String text = ScriptedText.resolve(node, "text", sandbox, input, ctx);
        if (!text.isEmpty()) {
            NodeConfig config = NodeConfig.of(node);
            ctx.getApi().speech().say(text, new SpeechOptions(config.text("voice"), config.decimal("speed")));
        }
        return NodeOutcome.next(text.isEmpty() ? null : text);
    }
}
