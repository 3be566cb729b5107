package com.taskmate.session;

import java.io.IOException;

/**
 * Transport-level handle of one connected client. Implementations must tolerate concurrent
 * {@link #send} calls.
 */
public interface ClientConnection {

    String id();

    boolean isOpen();

    void send(String payload) throws IOException;

    void close();
}
