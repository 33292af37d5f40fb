package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionTrigger {
    SCHEDULED,
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
