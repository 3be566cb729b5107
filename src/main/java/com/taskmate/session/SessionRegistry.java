package com.taskmate.session;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks live client sessions and delivers payloads to them. A failed delivery retires only the
 * session it was sent to; nothing here throws to the caller.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    public ChatSession register(ClientConnection connection) {
        ChatSession session = new ChatSession(connection);
        ChatSession previous = sessions.put(session.id(), session);
        if (previous != null) {
            log.warn("Session id={} registered twice; retiring the older handle", session.id());
            previous.retire();
        }
        log.info("Session registered id={} activeSessions={}", session.id(), sessions.size());
        return session;
    }

    public void unregister(ChatSession session) {
        if (session == null || !session.retire()) {
            return;
        }
        sessions.remove(session.id(), session);
        log.info("Session unregistered id={} activeSessions={}", session.id(), sessions.size());
    }

    Optional<ChatSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    int size() {
        return sessions.size();
    }

    /** @return whether the payload was handed to the connection */
    public boolean sendTo(ChatSession session, String payload) {
        if (!session.isLive()) {
            log.debug("Skipping send to closed session id={}", session.id());
            return false;
        }
        try {
            session.connection().send(payload);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Delivery to session id={} failed, unregistering: {}", session.id(), e.toString());
            unregister(session);
            closeConnection(session);
            return false;
        }
    }

    /** @return number of sessions the payload reached */
    public int broadcast(String payload) {
        List<ChatSession> targets = List.copyOf(sessions.values());
        int delivered = 0;
        for (ChatSession session : targets) {
            if (sendTo(session, payload)) {
                delivered++;
            }
        }
        log.debug("Broadcast delivered to {}/{} session(s)", delivered, targets.size());
        return delivered;
    }

    @PreDestroy
    public void shutdown() {
        List<ChatSession> remaining = List.copyOf(sessions.values());
        log.info("Closing {} session(s) on shutdown", remaining.size());
        for (ChatSession session : remaining) {
            unregister(session);
            closeConnection(session);
        }
    }

    private void closeConnection(ChatSession session) {
        try {
            session.connection().close();
        } catch (RuntimeException e) {
            log.debug("Ignoring close failure for session id={}: {}", session.id(), e.toString());
        }
    }
}
