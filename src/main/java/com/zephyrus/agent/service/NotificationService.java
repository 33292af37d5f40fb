package com.zephyrus.agent.service;

import com.zephyrus.agent.model.AgentSnapshot;
import com.zephyrus.agent.model.ExecutionRecord;
import com.zephyrus.agent.model.NotificationTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fans execution results out to an agent's enabled notification targets.
 * Delivery problems are logged and never affect the agent.
 */
@Slf4j
@Service
public class NotificationService {

    public static final String SLACK = "slack";

    private final SlackService slackService;

    public NotificationService(SlackService slackService) {
        this.slackService = slackService;
    }

    public void notifyExecution(AgentSnapshot agent, ExecutionRecord record) {
        for (NotificationTarget target : agent.getNotifications()) {
            if (record.isFailure() || target.isNotifyOnSuccess()) {
                deliver(target, formatExecution(agent, record));
            }
        }
    }

    public void notifyEscalation(AgentSnapshot agent, String reason) {
        String message = ":rotating_light: Agent *" + label(agent) + "* moved to error: " + reason;
        agent.getNotifications().forEach(target -> deliver(target, message));
    }

    String formatExecution(AgentSnapshot agent, ExecutionRecord record) {
        StringBuilder text = new StringBuilder();
        text.append(record.isFailure() ? ":x: " : ":white_check_mark: ")
            .append("Agent *").append(label(agent)).append("* ")
            .append(record.getTrigger().wireName()).append(" run ")
            .append(record.getOutcome().wireName());
        if (record.getFunctionName() != null) {
            text.append("\nFunction: `").append(record.getFunctionName()).append('`');
        }
        if (record.getCallId() != null) {
            text.append("\nTransaction: ").append(record.getCallId());
        }
        if (record.getResult() != null) {
            text.append("\nResult: ").append(record.getResult());
        }
        if (record.getErrorDetail() != null) {
            text.append("\nError: ").append(record.getErrorDetail());
        }
        return text.toString();
    }

    private void deliver(NotificationTarget target, String message) {
        if (!SLACK.equalsIgnoreCase(target.getType())) {
            log.debug("No delivery channel for notification type {}", target.getType());
            return;
        }
        try {
            slackService.postMessage(target.getChannel(), message);
        } catch (RuntimeException e) {
            log.warn("Notification {} failed", target.getNotificationId(), e);
        }
    }

    private static String label(AgentSnapshot agent) {
        return agent.getName() != null ? agent.getName() : agent.getAgentId();
    }
}
