package com.zephyrus.agent.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NotificationTarget {
    String notificationId;
    String type;
    String channel;
    boolean notifyOnSuccess;
    boolean enabled;
}
