package com.taskmate.session;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A registered client connection. Only {@link SessionRegistry} creates and retires sessions.
 */
public final class ChatSession {

    private final ClientConnection connection;
    private final AtomicBoolean live = new AtomicBoolean(true);

    ChatSession(ClientConnection connection) {
        this.connection = connection;
    }

    public String id() {
        return connection.id();
    }

    public boolean isLive() {
        return live.get() && connection.isOpen();
    }

    ClientConnection connection() {
        return connection;
    }

    /** @return true for the caller that actually retired the session */
    boolean retire() {
        return live.compareAndSet(true, false);
    }

    @Override
    public String toString() {
        return "ChatSession[" + id() + "]";
    }
}
