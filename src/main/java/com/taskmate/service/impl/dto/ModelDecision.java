package com.taskmate.service.impl.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
@AllArgsConstructor
public class ModelDecision {
    private final List<ToolCall> toolCalls;
    private final String content;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static ModelDecision finalOnly(String content) {
        return new ModelDecision(Collections.emptyList(), content);
    }

    public static ModelDecision tools(List<ToolCall> toolCalls) {
        return tools(toolCalls, "");
    }

    public static ModelDecision tools(List<ToolCall> toolCalls, String content) {
        return new ModelDecision(List.copyOf(toolCalls), content != null ? content : "");
    }
}
