package com.taskmate.service.impl.dto;

import com.taskmate.tools.AiToolExecutor;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** A tool invocation as the model issued it, before it is bound to a session. */
@Getter
@AllArgsConstructor
public class ToolCall {
    private final String id;
    private final String name;
    private final String argumentsJson;

    public AiToolExecutor.ToolCall forSession(String sessionId) {
        return new AiToolExecutor.ToolCall(id, name, argumentsJson, sessionId);
    }
}
