package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleType {
    INTERVAL,
    CRON;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
