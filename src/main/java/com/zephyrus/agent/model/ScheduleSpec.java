package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * {@code create_schedule} payload.
 */
@Data
public class ScheduleSpec {
    @JsonAlias({"scheduleType", "type"})
    private String scheduleType;
    @JsonAlias({"intervalSeconds", "interval"})
    private Long intervalSeconds;
    @JsonAlias({"cronExpression", "cron"})
    private String cronExpression;
    @JsonProperty("is_active")
    @JsonAlias({"isActive", "active"})
    private Boolean active;
}
