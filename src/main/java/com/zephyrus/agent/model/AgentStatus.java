package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentStatus {
    CREATED,
    CONFIGURED,
    RUNNING,
    STOPPED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
