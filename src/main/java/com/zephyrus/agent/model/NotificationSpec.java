package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/**
 * {@code create_notification} payload.
 */
@Data
public class NotificationSpec {
    @JsonAlias({"notificationType", "type"})
    private String notificationType;
    private Map<String, Object> configuration;
    @JsonProperty("is_enabled")
    @JsonAlias({"isEnabled", "enabled"})
    private Boolean enabled;
}
