package com.zephyrus.agent.config;

import com.zephyrus.agent.connection.AgentWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AgentWebSocketHandler handler;
    private final String path;

    public WebSocketConfig(AgentWebSocketHandler handler, @Value("${agent.websocket.path:/ws}") String path) {
        this.handler = handler;
        this.path = path;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path, path + "/agent/*").setAllowedOrigins("*");
    }
}
