package com.castleflow.castleflow_backend.executor.impl;

import com.castleflow.castleflow_backend.engine.ExecutionContext;
import com.castleflow.castleflow_backend.executor.NodeConfig;
import com.castleflow.castleflow_backend.executor.NodeExecutor;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;
import com.castleflow.castleflow_backend.model.execution.NodeOutcome;
import com.castleflow.castleflow_backend.model.execution.NotificationSeverity;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class NotificationExecutor implements NodeExecutor {

    @Override
    public NodeType supportedType() {
        return NodeType.NOTIFICATION;
    }

    @Override
    public NodeOutcome execute(AutomateNode node, Map<String, Object> input, ExecutionContext ctx) {
        NodeConfig config = NodeConfig.of(node);
        ctx.getApi().notify(config.text("message", ""), NotificationSeverity.fromKey(config.text("severity")));
        return NodeOutcome.next(null);
    }
}
