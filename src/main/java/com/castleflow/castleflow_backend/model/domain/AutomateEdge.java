package com.castleflow.castleflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutomateEdge {

    private String id;
    private String sourceNodeId;
    private String sourcePortId;
    private String targetNodeId;
    private String targetPortId;
    private String label;
    private boolean disabled;
}
