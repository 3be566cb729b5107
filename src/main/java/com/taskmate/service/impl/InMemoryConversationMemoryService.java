package com.taskmate.service.impl;

import com.taskmate.config.AiProperties;
import com.taskmate.service.ConversationMemoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the last {@code ai.memory.max-messages} messages per session.
 */
@Service
@Slf4j
public class InMemoryConversationMemoryService implements ConversationMemoryService {

    private final Map<String, List<Map<String, Object>>> conversations = new ConcurrentHashMap<>();
    private final int window;

    public InMemoryConversationMemoryService(AiProperties properties) {
        this.window = Math.max(2, properties.getMemory().getMaxMessages());
    }

    @Override
    public List<Map<String, Object>> getHistory(String sessionId) {
        List<Map<String, Object>> stored = conversations.getOrDefault(sessionId, Collections.emptyList());
        List<Map<String, Object>> history = new ArrayList<>(stored.size());
        for (Map<String, Object> message : stored) {
            history.add(new HashMap<>(message));
        }
        log.debug("History lookup sessionId={} -> {} message(s)", sessionId, history.size());
        return history;
    }

    @Override
    public void appendMessages(String sessionId, List<Map<String, Object>> messages) {
        conversations.compute(sessionId, (id, existing) -> {
            List<Map<String, Object>> target = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            target.addAll(messages);
            if (target.size() > window) {
                target = new ArrayList<>(target.subList(target.size() - window, target.size()));
            }
            log.debug("Appended {} message(s) sessionId={} -> total={}", messages.size(), sessionId, target.size());
            return List.copyOf(target);
        });
    }

    @Override
    public void clear(String sessionId) {
        List<Map<String, Object>> removed = conversations.remove(sessionId);
        if (removed != null) {
            log.debug("Cleared conversation memory sessionId={} removedMessages={}", sessionId, removed.size());
        }
    }
}
