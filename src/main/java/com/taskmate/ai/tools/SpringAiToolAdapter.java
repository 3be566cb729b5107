package com.taskmate.ai.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmate.tools.AiTool;
import com.taskmate.tools.AiToolExecutor;
import com.taskmate.tools.ToolRegistry;
import com.taskmate.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Exposes the registered task tools as Spring AI {@link ToolCallback}s so their definitions
 * reach the model. The gateway disables Spring AI's internal tool execution; {@link #call}
 * is only a fallback for code paths that execute callbacks directly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringAiToolAdapter {

    static final String DIRECT_SESSION_ID = "direct";

    private final ToolRegistry registry;
    private final AiToolExecutor executor;
    private final ObjectMapper mapper;

    public List<ToolCallback> toolCallbacks() {
        return registry.all().stream()
                .<ToolCallback>map(TaskToolCallback::new)
                .toList();
    }

    private String schemaJson(AiTool tool) {
        try {
            return mapper.writeValueAsString(tool.parametersSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise parameter schema of tool " + tool.name(), e);
        }
    }

    private final class TaskToolCallback implements ToolCallback {

        private final AiTool tool;
        private final ToolDefinition definition;

        private TaskToolCallback(AiTool tool) {
            this.tool = tool;
            this.definition = ToolDefinition.builder()
                    .name(tool.name())
                    .description(tool.description())
                    .inputSchema(schemaJson(tool))
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            log.debug("Direct callback invocation of tool '{}'", tool.name());
            ToolResult result = executor.dispatch(new AiToolExecutor.ToolCall(
                    "call-" + UUID.randomUUID(), tool.name(), toolInput, DIRECT_SESSION_ID));
            return result.text();
        }
    }
}
