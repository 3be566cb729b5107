package com.taskmate.service.impl.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Messages accumulated while one inbound message is processed. Not shared between turns.
 */
public class ConversationTurn {

    private final String sessionId;
    private final String userMessage;
    private final List<Map<String, Object>> messages = new ArrayList<>();
    private int rounds;
    private boolean mutated;

    public ConversationTurn(String sessionId, String userMessage, List<Map<String, Object>> opening) {
        this.sessionId = sessionId;
        this.userMessage = userMessage;
        this.messages.addAll(opening);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserMessage() {
        return userMessage;
    }

    public List<Map<String, Object>> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void append(List<Map<String, Object>> more) {
        messages.addAll(more);
    }

    public int getRounds() {
        return rounds;
    }

    public int nextRound() {
        return ++rounds;
    }

    public boolean isMutated() {
        return mutated;
    }

    public void markMutated() {
        mutated = true;
    }
}
