package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionParameter {
    @JsonAlias({"paramName", "param_name"})
    private String name;
    @JsonAlias({"paramType", "param_type"})
    private String type;
    @JsonAlias({"defaultValue"})
    private Object defaultValue;

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
