package com.zephyrus.agent.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlackServiceTest {

    @Mock
    private Slack slack;

    @Mock
    private MethodsClient methods;

    private SlackService slackService;

    @BeforeEach
    void setUp() {
        slackService = new SlackService(slack);
    }

    @Test
    void shouldDropMessagesWithoutToken() {
        slackService.setSlackBotToken("");

        assertFalse(slackService.isConfigured());
        assertNull(slackService.postMessage("#ops", "hello"));
        verifyNoInteractions(slack);
    }

    @Test
    void shouldReturnTimestampOfPostedMessage() throws Exception {
        slackService.setSlackBotToken("xoxb-test");
        ChatPostMessageResponse response = new ChatPostMessageResponse();
        response.setOk(true);
        response.setTs("1700000000.000100");
        when(slack.methods("xoxb-test")).thenReturn(methods);
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(response);

        assertEquals("1700000000.000100", slackService.postMessage("#ops", "hello"));

        ArgumentCaptor<ChatPostMessageRequest> request = ArgumentCaptor.forClass(ChatPostMessageRequest.class);
        verify(methods).chatPostMessage(request.capture());
        assertEquals("#ops", request.getValue().getChannel());
        assertEquals("hello", request.getValue().getText());
    }

    @Test
    void shouldReturnNullWhenSlackRejectsMessage() throws Exception {
        slackService.setSlackBotToken("xoxb-test");
        ChatPostMessageResponse response = new ChatPostMessageResponse();
        response.setOk(false);
        response.setError("channel_not_found");
        when(slack.methods("xoxb-test")).thenReturn(methods);
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(response);

        assertNull(slackService.postMessage("#missing", "hello"));
    }

    @Test
    void shouldReturnNullOnTransportError() throws IOException, SlackApiException {
        slackService.setSlackBotToken("xoxb-test");
        when(slack.methods("xoxb-test")).thenReturn(methods);
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenThrow(new IOException("offline"));

        assertNull(slackService.postMessage("#ops", "hello"));
    }
}
