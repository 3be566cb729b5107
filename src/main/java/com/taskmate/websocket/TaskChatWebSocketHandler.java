package com.taskmate.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmate.config.TaskMateProperties;
import com.taskmate.service.TaskChatService;
import com.taskmate.session.ChatSession;
import com.taskmate.websocket.dto.ClientMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chat endpoint. Each connection gets its own inbox drained with {@code concatMap}, so turns of
 * one session run strictly one after another while different sessions proceed independently.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskChatWebSocketHandler extends TextWebSocketHandler {

    private final TaskChatService chatService;
    private final ObjectMapper mapper;
    private final TaskMateProperties properties;

    private final Map<String, Inbox> inboxes = new ConcurrentHashMap<>();

    private record Inbox(ChatSession session, Sinks.Many<String> sink) {
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocketSession) {
        TaskMateProperties.WebSocket settings = properties.getWebsocket();
        WebSocketClientConnection connection = new WebSocketClientConnection(
                webSocketSession, settings.getSendTimeLimitMs(), settings.getBufferSizeLimit());

        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        ChatSession session = chatService.onConnect(connection);
        inboxes.put(webSocketSession.getId(), new Inbox(session, sink));

        sink.asFlux()
                .concatMap(text -> chatService.handleMessage(session, text)
                        .onErrorResume(error -> {
                            log.error("Turn pipeline failed sessionId={}", session.id(), error);
                            return Mono.empty();
                        }))
                .subscribe(
                        ignored -> { },
                        error -> log.error("Inbox of session id={} terminated", session.id(), error),
                        () -> log.debug("Inbox of session id={} drained", session.id()));
        log.info("WebSocket connected id={} remote={}", webSocketSession.getId(), webSocketSession.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage frame) {
        Inbox inbox = inboxes.get(webSocketSession.getId());
        if (inbox == null) {
            log.warn("Frame received for unknown WebSocket session id={}", webSocketSession.getId());
            return;
        }
        String text = extractMessage(webSocketSession.getId(), frame.getPayload());
        if (text == null) {
            return;
        }
        Sinks.EmitResult result = inbox.sink().tryEmitNext(text);
        if (result.isFailure()) {
            log.warn("Could not queue message for session id={}: {}", webSocketSession.getId(), result);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
        log.warn("Transport error on WebSocket session id={}: {}", webSocketSession.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
        Inbox inbox = inboxes.remove(webSocketSession.getId());
        if (inbox == null) {
            return;
        }
        chatService.onDisconnect(inbox.session());
        // queued and in-flight turns still finish; their replies are dropped, their broadcasts are not
        inbox.sink().tryEmitComplete();
        log.info("WebSocket closed id={} status={}", webSocketSession.getId(), status);
    }

    private String extractMessage(String sessionId, String payload) {
        ClientMessage message;
        try {
            message = mapper.readValue(payload, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed frame from session id={}: {}", sessionId, e.getOriginalMessage());
            return null;
        }
        if (message == null || !StringUtils.hasText(message.getMessage())) {
            log.debug("Ignoring blank message from session id={}", sessionId);
            return null;
        }
        return message.getMessage().trim();
    }
}
