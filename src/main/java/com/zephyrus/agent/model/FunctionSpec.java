package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * {@code create_function} payload.
 */
@Data
public class FunctionSpec {
    @JsonAlias({"functionName", "name"})
    private String functionName;
    @JsonAlias({"functionSignature", "signature"})
    private String functionSignature;
    @JsonAlias({"functionType", "direction"})
    private String functionType;
    @JsonProperty("is_enabled")
    @JsonAlias({"isEnabled", "enabled"})
    private Boolean enabled;
    @JsonAlias({"validationRules"})
    private Map<String, ParameterRule> validationRules;
    @JsonAlias({"returnRule"})
    private ParameterRule returnRule;
    private List<FunctionParameter> parameters;
    private Map<String, Object> abi;
}
