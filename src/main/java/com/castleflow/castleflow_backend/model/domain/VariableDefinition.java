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
public class VariableDefinition {

    private String name;
    // string | number | boolean | object | array
    private String type;
    private Object defaultValue;
    private String description;
}
