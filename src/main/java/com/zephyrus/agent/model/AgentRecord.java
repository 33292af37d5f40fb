package com.zephyrus.agent.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable agent row held by the agent manager. Never handed out directly;
 * callers receive {@link AgentSnapshot} or {@link AgentView} copies.
 */
@Data
public class AgentRecord {
    private String id;
    private String name;
    private String description;
    private String owner;
    private String contractId;
    private String contractAddress;
    private List<Map<String, Object>> abi = new ArrayList<>();
    private Long networkId;
    private String gasLimit;
    private String maxPriorityFee;
    private Map<String, Object> contractState = new HashMap<>();

    private boolean connectionScoped;
    private String ownerConnectionId;

    private Map<String, ContractFunction> functions = new LinkedHashMap<>();
    private Schedule schedule;
    private List<NotificationTarget> notifications = new ArrayList<>();

    private AgentStatus status = AgentStatus.CREATED;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastExecutedAt;
    private int consecutiveFailures;
    private ExecutionRecord lastExecution;

    public boolean hasEnabledFunction() {
        return functions.values().stream().anyMatch(ContractFunction::isEnabled);
    }

    public boolean hasExecutableSchedule(Instant now) {
        return schedule != null && schedule.firesAfter(now);
    }

    public AgentSnapshot toSnapshot() {
        AgentSnapshot.AgentSnapshotBuilder builder = AgentSnapshot.builder()
            .agentId(id)
            .name(name)
            .description(description)
            .owner(owner)
            .contractAddress(contractAddress)
            .abi(List.copyOf(abi))
            .networkId(networkId)
            .gasLimit(gasLimit)
            .maxPriorityFee(maxPriorityFee)
            .contractState(Collections.unmodifiableMap(new LinkedHashMap<>(contractState)))
            .status(status);
        functions.values().stream()
            .filter(ContractFunction::isEnabled)
            .forEach(builder::function);
        notifications.stream()
            .filter(NotificationTarget::isEnabled)
            .forEach(builder::notification);
        return builder.build();
    }

    public AgentView toView(Instant nextDueAt) {
        return AgentView.builder()
            .agentId(id)
            .name(name)
            .description(description)
            .owner(owner)
            .contractAddress(contractAddress)
            .status(status)
            .functions(List.copyOf(functions.values()))
            .schedule(schedule)
            .lastExecutedAt(lastExecutedAt)
            .nextDueAt(nextDueAt)
            .consecutiveFailures(consecutiveFailures)
            .lastExecution(lastExecution)
            .build();
    }
}
