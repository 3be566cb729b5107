package com.taskmate.service;

import com.taskmate.service.impl.dto.TurnOutcome;
import com.taskmate.session.ChatSession;
import reactor.core.publisher.Mono;

public interface ConversationOrchestrator {

    /**
     * Processes one inbound message: alternates model calls and tool dispatch until the model
     * answers with text or the configured bound is reached.
     *
     * <p>Fails with {@link com.taskmate.exception.ModelInvocationException} when the model cannot
     * be reached; tool failures never fail the turn.</p>
     */
    Mono<TurnOutcome> run(ChatSession session, String userMessage);
}
