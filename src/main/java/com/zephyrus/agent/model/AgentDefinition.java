package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored agent configuration, one YAML file per agent under {@code agent.config.path}.
 */
@Data
public class AgentDefinition {
    @JsonAlias({"agentId"})
    private String agentId;
    @JsonAlias({"autoStart"})
    private boolean autoStart;
    private AgentSpec agent;
    private List<FunctionSpec> functions = new ArrayList<>();
    private ScheduleSpec schedule;
    private List<NotificationSpec> notifications = new ArrayList<>();
}
