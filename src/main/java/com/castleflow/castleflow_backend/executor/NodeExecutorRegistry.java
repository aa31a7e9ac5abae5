package com.castleflow.castleflow_backend.executor;

import com.castleflow.castleflow_backend.model.domain.NodeType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class NodeExecutorRegistry {

    private final List<NodeExecutor> executors;
    private final Map<NodeType, NodeExecutor> registry = new EnumMap<>(NodeType.class);

    @PostConstruct
    public void init() {
        executors.forEach(executor -> registry.put(executor.supportedType(), executor));
        for (NodeType type : NodeType.values()) {
            if (type != NodeType.UNKNOWN && !registry.containsKey(type)) {
                log.warn("No executor registered for node type {}", type.getKey());
            }
        }
    }

    public NodeExecutor get(NodeType type) {
        NodeExecutor executor = type != null ? registry.get(type) : null;
        if (executor == null) {
            throw new UnsupportedOperationException("No executor registered for node type: "
                    + (type != null ? type.getKey() : "null"));
        }
        return executor;
    }
}
