package com.taskmate.service.impl;

import com.taskmate.config.AiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryConversationMemoryServiceTests {

    private InMemoryConversationMemoryService service;

    @BeforeEach
    void setUp() {
        AiProperties properties = new AiProperties();
        properties.getMemory().setMaxMessages(4);
        service = new InMemoryConversationMemoryService(properties);
    }

    @Test
    void keepsOnlyTheMostRecentWindow() {
        for (int i = 1; i <= 3; i++) {
            service.appendMessages("s1", List.of(
                    Map.of("role", "user", "content", "q" + i),
                    Map.of("role", "assistant", "content", "a" + i)));
        }

        assertThat(service.getHistory("s1")).extracting(message -> message.get("content"))
                .containsExactly("q2", "a2", "q3", "a3");
    }

    @Test
    void sessionsAreIsolatedAndClearable() {
        service.appendMessages("s1", List.of(Map.of("role", "user", "content", "mine")));
        service.appendMessages("s2", List.of(Map.of("role", "user", "content", "theirs")));

        service.clear("s1");

        assertThat(service.getHistory("s1")).isEmpty();
        assertThat(service.getHistory("s2")).hasSize(1);
    }

    @Test
    void historyIsACopy() {
        service.appendMessages("s1", List.of(Map.of("role", "user", "content", "hi")));

        service.getHistory("s1").clear();

        assertThat(service.getHistory("s1")).hasSize(1);
    }
}
