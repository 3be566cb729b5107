package com.taskmate.tools;

import org.springframework.lang.Nullable;

/**
 * Outcome of one tool invocation. {@code text} is always present and is what the model sees;
 * {@code payload} carries the created/updated task, the deleted id or the listed tasks.
 */
public record ToolResult(String toolName,
                         @Nullable TaskOperation operation,
                         Status status,
                         String text,
                         @Nullable Object payload) {

    public enum Status {
        SUCCESS, VALIDATION_ERROR, NOT_FOUND, FAILED
    }

    public static ToolResult success(TaskOperation operation, String text, @Nullable Object payload) {
        return new ToolResult(operation.toolName(), operation, Status.SUCCESS, text, payload);
    }

    public static ToolResult failure(String toolName, @Nullable TaskOperation operation, Status status, String text) {
        return new ToolResult(toolName, operation, status, text, null);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public boolean mutatedStore() {
        return succeeded() && operation != null && operation.isMutating();
    }
}
