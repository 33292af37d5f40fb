package com.zephyrus.agent.connection;

import com.zephyrus.agent.protocol.ProtocolHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;

/**
 * Spring WebSocket entry point. Frames of one session are delivered one at a
 * time, so each connection is processed in arrival order.
 */
@Slf4j
@Component
public class AgentWebSocketHandler extends TextWebSocketHandler {

    static final String AGENT_PATH_SEGMENT = "/agent/";

    private final ProtocolHandler protocolHandler;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimit;

    public AgentWebSocketHandler(ProtocolHandler protocolHandler,
                                 @Value("${agent.websocket.send-time-limit-ms:10000}") int sendTimeLimitMillis,
                                 @Value("${agent.websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.protocolHandler = protocolHandler;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
        protocolHandler.onOpen(new WebSocketClientConnection(concurrent), agentIdFromPath(session.getUri()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        protocolHandler.onFrame(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            try {
                session.close(CloseStatus.SERVER_ERROR);
            } catch (IOException e) {
                log.debug("Close after transport error failed for {}", session.getId(), e);
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Connection {} closed with {}", session.getId(), status);
        protocolHandler.onClose(session.getId());
    }

    static String agentIdFromPath(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        int index = path.lastIndexOf(AGENT_PATH_SEGMENT);
        if (index < 0) {
            return null;
        }
        String agentId = path.substring(index + AGENT_PATH_SEGMENT.length());
        if (agentId.endsWith("/")) {
            agentId = agentId.substring(0, agentId.length() - 1);
        }
        return agentId.isEmpty() || agentId.contains("/") ? null : agentId;
    }
}
