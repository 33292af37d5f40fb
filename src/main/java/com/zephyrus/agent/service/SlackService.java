package com.zephyrus.agent.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Slf4j
@Service
public class SlackService {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    private final Slack slack;

    public SlackService() {
        this(Slack.getInstance());
    }

    SlackService(Slack slack) {
        this.slack = slack;
    }

    public boolean isConfigured() {
        return slackBotToken != null && !slackBotToken.isBlank();
    }

    /**
     * Posts a message to a channel and returns the message timestamp, or null
     * when the post failed or no token is configured.
     */
    public String postMessage(String channel, String message) {
        if (!isConfigured()) {
            log.debug("Slack token not configured, dropping message for {}", channel);
            return null;
        }
        try {
            MethodsClient methods = slack.methods(slackBotToken);

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(channel)
                .text(message)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (response.isOk()) {
                return response.getTs();
            }
            log.warn("Failed to post message to {}: {}", channel, response.getError());
            return null;
        } catch (IOException | SlackApiException e) {
            log.warn("Failed to post message to {}", channel, e);
            return null;
        }
    }

    void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }
}
