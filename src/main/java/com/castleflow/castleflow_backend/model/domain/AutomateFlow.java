package com.castleflow.castleflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A user-authored automation flow as stored in a {@code *.automate.json} file.
 * Editor-only fields (positions, viewport, ports) are ignored on load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutomateFlow {

    private String id;
    private String name;
    private String description;
    private int version;
    private FlowRuntime runtime;

    @Builder.Default
    private List<AutomateNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<AutomateEdge> edges = new ArrayList<>();

    @Builder.Default
    private List<VariableDefinition> variables = new ArrayList<>();

    private Long createdAt;
    private Long updatedAt;

    public FlowRuntime effectiveRuntime() {
        return runtime != null ? runtime : FlowRuntime.UNIVERSAL;
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
