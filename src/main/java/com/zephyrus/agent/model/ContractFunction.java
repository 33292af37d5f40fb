package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A contract function an agent is allowed to call. Immutable so that snapshots
 * handed to a running execution cannot change under it.
 */
@Value
@Builder(toBuilder = true)
public class ContractFunction {
    String functionId;
    String name;
    String signature;
    FunctionDirection direction;
    boolean enabled;
    @Singular
    List<FunctionParameter> parameters;
    @Singular
    Map<String, ParameterRule> validationRules;
    ParameterRule returnRule;
    Map<String, Object> abi;

    @JsonIgnore
    public boolean isRead() {
        return direction == FunctionDirection.READ;
    }

    public boolean takesNoArguments() {
        return parameters.isEmpty();
    }
}
