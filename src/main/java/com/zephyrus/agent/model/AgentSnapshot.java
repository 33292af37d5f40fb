package com.zephyrus.agent.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only copy of an agent taken at the start of a run. Holds only the
 * enabled functions.
 */
@Value
@Builder
public class AgentSnapshot {
    String agentId;
    String name;
    String description;
    String owner;
    String contractAddress;
    List<Map<String, Object>> abi;
    Long networkId;
    String gasLimit;
    String maxPriorityFee;
    Map<String, Object> contractState;
    AgentStatus status;
    @Singular
    List<ContractFunction> functions;
    @Singular
    List<NotificationTarget> notifications;

    public Optional<ContractFunction> findFunction(String functionName) {
        return functions.stream()
            .filter(f -> f.getName().equals(functionName))
            .findFirst();
    }
}
