package com.taskmate.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmate.exception.TaskNotFoundException;
import com.taskmate.exception.ToolArgumentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tool dispatcher. Every failure mode (unknown tool, malformed JSON, invalid argument, missing
 * task, store error) comes back as a {@link ToolResult} so the model can react to it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiToolExecutor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ToolRegistry registry;
    private final ObjectMapper mapper;

    /** One tool invocation requested by the model, scoped to the session whose turn issued it. */
    public record ToolCall(String id, String name, String argumentsJson, String sessionId) {}

    public ToolResult dispatch(ToolCall call) {
        log.debug("Dispatching tool call id={} name={} sessionId={}", call.id(), call.name(), call.sessionId());
        AiTool tool = registry.get(call.name()).orElse(null);
        if (tool == null) {
            log.warn("Model requested unknown tool '{}' sessionId={}", call.name(), call.sessionId());
            return ToolResult.failure(Objects.toString(call.name(), ""), null, ToolResult.Status.VALIDATION_ERROR,
                    "Unknown tool '" + call.name() + "'. Available tools: " + availableToolNames() + ".");
        }

        Map<String, Object> args;
        try {
            args = parseArguments(call.argumentsJson());
        } catch (JsonProcessingException e) {
            log.warn("Tool '{}' call id={} carried malformed arguments: {}", tool.name(), call.id(), e.getOriginalMessage());
            return ToolResult.failure(tool.name(), tool.operation(), ToolResult.Status.VALIDATION_ERROR,
                    "Could not read the arguments for " + tool.name() + ": they must be a JSON object.");
        }

        ToolResult result;
        try {
            result = tool.execute(new ToolArguments(args));
        } catch (ToolArgumentException e) {
            log.info("Tool '{}' rejected arguments: {}", tool.name(), e.getMessage());
            result = ToolResult.failure(tool.name(), tool.operation(), ToolResult.Status.VALIDATION_ERROR,
                    "Invalid arguments for " + tool.name() + ": " + e.getMessage());
        } catch (TaskNotFoundException e) {
            log.info("Tool '{}' could not find task id={}", tool.name(), e.getTaskId());
            result = ToolResult.failure(tool.name(), tool.operation(), ToolResult.Status.NOT_FOUND, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Tool '{}' execution failed", tool.name(), e);
            result = ToolResult.failure(tool.name(), tool.operation(), ToolResult.Status.FAILED,
                    "The task store could not complete " + tool.name() + ". Please try again.");
        }

        log.debug("Tool '{}' call id={} finished status={} textLength={}",
                tool.name(), call.id(), result.status(), result.text().length());
        return result;
    }

    /** Dispatches sequentially; results keep the order of {@code calls}. */
    public List<ToolResult> executeAll(List<ToolCall> calls) {
        log.debug("Executing {} tool call(s)", calls.size());
        List<ToolResult> results = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            results.add(dispatch(call));
        }
        log.debug("Completed execution of {} tool call(s)", results.size());
        return results;
    }

    public Map<String, Object> toAssistantToolCallsMessage(String content, List<ToolCall> calls) {
        List<Map<String, Object>> arr = new ArrayList<>();
        for (ToolCall call : calls) {
            log.trace("Preparing assistant tool call message id={} name={}", call.id(), call.name());
            arr.add(Map.of(
                    "id", call.id(),
                    "type", "function",
                    "function", Map.of(
                            "name", Objects.toString(call.name(), ""),
                            "arguments", Objects.requireNonNullElse(call.argumentsJson(), "{}")
                    )
            ));
        }
        return Map.of(
                "role", "assistant",
                "tool_calls", arr,
                "content", Objects.requireNonNullElse(content, "")
        );
    }

    public Map<String, Object> toToolMessage(ToolCall call, ToolResult result) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "tool");
        message.put("tool_call_id", call.id());
        message.put("name", result.toolName());
        message.put("content", result.text());
        return message;
    }

    private Map<String, Object> parseArguments(String argumentsJson) throws JsonProcessingException {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed = mapper.readValue(argumentsJson, MAP_TYPE);
        return parsed != null ? parsed : Map.of();
    }

    private String availableToolNames() {
        return String.join(", ", registry.all().stream().map(AiTool::name).toList());
    }
}
