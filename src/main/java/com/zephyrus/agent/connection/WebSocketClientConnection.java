package com.zephyrus.agent.connection;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Adapts a Spring {@link WebSocketSession}. The session is expected to be a
 * {@code ConcurrentWebSocketSessionDecorator} since scheduler workers and the
 * read loop send concurrently.
 */
public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;

    public WebSocketClientConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void closeForBadData(String reason) throws IOException {
        session.close(CloseStatus.BAD_DATA.withReason(truncate(reason)));
    }

    static final int MAX_REASON_BYTES = 123;

    // close reasons are limited to 123 bytes of UTF-8
    static String truncate(String reason) {
        if (reason == null || reason.getBytes(StandardCharsets.UTF_8).length <= MAX_REASON_BYTES) {
            return reason;
        }
        int bytes = 0;
        int end = 0;
        while (end < reason.length()) {
            int codePoint = reason.codePointAt(end);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + width > MAX_REASON_BYTES) {
                break;
            }
            bytes += width;
            end += Character.charCount(codePoint);
        }
        return reason.substring(0, end);
    }
}
