package com.taskmate.service;

import java.util.List;
import java.util.Map;

/**
 * Short-lived chat memory scoped to one connection. Entries are role/content maps in the same
 * shape the model gateway consumes.
 */
public interface ConversationMemoryService {

    List<Map<String, Object>> getHistory(String sessionId);

    void appendMessages(String sessionId, List<Map<String, Object>> messages);

    void clear(String sessionId);
}
