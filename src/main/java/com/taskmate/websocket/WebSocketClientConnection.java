package com.taskmate.websocket;

import com.taskmate.session.ClientConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring {@link WebSocketSession}. Sends are serialised by
 * {@link ConcurrentWebSocketSessionDecorator}, so replies and broadcasts never interleave.
 */
@Slf4j
class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;

    WebSocketClientConnection(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Closing WebSocket session id={} failed: {}", session.getId(), e.toString());
        }
    }
}
