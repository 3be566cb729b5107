package com.taskmate.config;

import com.taskmate.websocket.TaskChatWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final TaskChatWebSocketHandler chatHandler;
    private final TaskMateProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        TaskMateProperties.WebSocket ws = properties.getWebsocket();
        log.info("Registering chat WebSocket endpoint path={} allowedOrigins={}", ws.getPath(), ws.getAllowedOrigins());
        registry.addHandler(chatHandler, ws.getPath())
                .setAllowedOrigins(ws.getAllowedOrigins().toArray(String[]::new));
    }
}
