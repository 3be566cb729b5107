package com.taskmate.service.impl;

import com.taskmate.exception.ModelInvocationException;
import com.taskmate.service.ConversationMemoryService;
import com.taskmate.service.ConversationOrchestrator;
import com.taskmate.service.TaskChatService;
import com.taskmate.session.ChatSession;
import com.taskmate.session.ClientConnection;
import com.taskmate.session.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j
public class TaskChatServiceImpl implements TaskChatService {

    static final String UNEXPECTED_ERROR_TEXT = "Something went wrong while processing your message. Please try again.";

    private final SessionRegistry sessionRegistry;
    private final ConversationOrchestrator orchestrator;
    private final TaskBroadcastCoordinator coordinator;
    private final ConversationMemoryService memoryService;

    @Override
    public ChatSession onConnect(ClientConnection connection) {
        ChatSession session = sessionRegistry.register(connection);
        coordinator.sendInitialSnapshot(session);
        return session;
    }

    @Override
    public Mono<Void> handleMessage(ChatSession session, String message) {
        log.debug("Handling message sessionId={} length={}", session.id(), message.length());
        return orchestrator.run(session, message)
                .doOnNext(outcome -> coordinator.afterTurn(session, outcome))
                .then()
                .onErrorResume(ModelInvocationException.class, error -> {
                    log.warn("Model invocation failed sessionId={}: {}", session.id(), error.getMessage());
                    coordinator.afterFailure(session, error);
                    return Mono.empty();
                })
                .onErrorResume(error -> {
                    log.error("Unexpected failure while handling message sessionId={}", session.id(), error);
                    coordinator.reportError(session, UNEXPECTED_ERROR_TEXT);
                    return Mono.empty();
                });
    }

    @Override
    public void onDisconnect(ChatSession session) {
        sessionRegistry.unregister(session);
        memoryService.clear(session.id());
    }
}
