package com.castleflow.castleflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A vertex of a flow. {@code config} is free-form and interpreted by the executor
 * registered for {@link #nodeType}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutomateNode {

    private String id;
    private NodeType nodeType;
    private String name;
    private String description;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    private String script;
    private boolean disabled;

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
