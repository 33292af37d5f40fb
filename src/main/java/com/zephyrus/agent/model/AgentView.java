package com.zephyrus.agent.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Status view returned to clients.
 */
@Value
@Builder
public class AgentView {
    String agentId;
    String name;
    String description;
    String owner;
    String contractAddress;
    AgentStatus status;
    List<ContractFunction> functions;
    Schedule schedule;
    Instant lastExecutedAt;
    Instant nextDueAt;
    int consecutiveFailures;
    ExecutionRecord lastExecution;
}
