package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionOutcome {
    SUCCESS,
    FAILURE,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
