package com.taskmate.service;

import com.taskmate.session.ChatSession;
import com.taskmate.session.ClientConnection;
import reactor.core.publisher.Mono;

/**
 * Connection lifecycle as seen by the chat transport.
 */
public interface TaskChatService {

    /** Registers the connection and sends it the current task list. */
    ChatSession onConnect(ClientConnection connection);

    /** Runs one turn and delivers its reply and any resulting snapshot. Never errors. */
    Mono<Void> handleMessage(ChatSession session, String message);

    void onDisconnect(ChatSession session);
}
