package com.castleflow.castleflow_backend.engine;

import com.castleflow.castleflow_backend.model.domain.AutomateEdge;
import com.castleflow.castleflow_backend.model.domain.AutomateFlow;
import com.castleflow.castleflow_backend.model.domain.AutomateNode;
import com.castleflow.castleflow_backend.model.domain.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only adjacency view of a flow. Disabled edges are left out; edges pointing at
 * missing nodes stay in the index and are skipped at traversal time.
 * Both indexes keep the edge order of the flow document.
 */
public final class FlowGraph {

    private final Map<String, AutomateNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<AutomateEdge>> outEdges = new HashMap<>();
    private final Map<String, List<AutomateEdge>> inEdges = new HashMap<>();

    private FlowGraph(AutomateFlow flow) {
        if (flow.getNodes() != null) {
            flow.getNodes().forEach(node -> nodes.put(node.getId(), node));
        }
        if (flow.getEdges() != null) {
            for (AutomateEdge edge : flow.getEdges()) {
                if (edge.isDisabled()) continue;
                outEdges.computeIfAbsent(edge.getSourceNodeId(), k -> new ArrayList<>()).add(edge);
                inEdges.computeIfAbsent(edge.getTargetNodeId(), k -> new ArrayList<>()).add(edge);
            }
        }
    }

    public static FlowGraph of(AutomateFlow flow) {
        return new FlowGraph(flow);
    }

    public Optional<AutomateNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<AutomateEdge> outgoing(String nodeId) {
        return Collections.unmodifiableList(outEdges.getOrDefault(nodeId, List.of()));
    }

    public List<AutomateEdge> outgoing(String nodeId, String portId) {
        return outEdges.getOrDefault(nodeId, List.of()).stream()
                .filter(edge -> portId.equals(edge.getSourcePortId()))
                .toList();
    }

    public List<AutomateEdge> incoming(String nodeId) {
        return Collections.unmodifiableList(inEdges.getOrDefault(nodeId, List.of()));
    }

    /**
     * Distinct input ports of {@code nodeId} that can actually receive a value:
     * the edge is enabled and its source node exists and is enabled.
     */
    public Set<String> deliverableInputPorts(String nodeId) {
        Set<String> ports = new LinkedHashSet<>();
        for (AutomateEdge edge : inEdges.getOrDefault(nodeId, List.of())) {
            AutomateNode source = nodes.get(edge.getSourceNodeId());
            if (source != null && !source.isDisabled()) {
                ports.add(edge.getTargetPortId());
            }
        }
        return ports;
    }

    public List<AutomateNode> startNodes() {
        return nodes.values().stream()
                .filter(node -> node.getNodeType() == NodeType.START && !node.isDisabled())
                .toList();
    }
}
