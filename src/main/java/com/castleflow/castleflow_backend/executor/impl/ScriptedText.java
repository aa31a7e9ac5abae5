package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.engine.ScriptSandbox;
import com.castleflow.castleflow_backend.executor.NodeConfig;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;

import java.util.Map;

final class ScriptedText {

    private ScriptedText() {
    }

    static String resolve(AutomateNode node, String configKey, ScriptSandbox sandbox,
                          Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        if (config.flag("useScript") && node.getScript() != null && !node.getScript().isBlank()) {
            Object value = sandbox.execute(node.getScript(), ctx.getApi(), input, ctx.getVariables());
            return value != null ? value.toString() : "";
        }
        return config.text(configKey, "");
    }
}
