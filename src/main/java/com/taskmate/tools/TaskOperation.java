package com.taskmate.tools;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of operations the model may request. New operations are added here first;
 * {@link ToolRegistry} refuses to start unless every variant has exactly one tool.
 */
public enum TaskOperation {
    CREATE("create_task", true),
    UPDATE("update_task", true),
    DELETE("delete_task", true),
    LIST("list_tasks", false),
    FILTER("filter_tasks", false);

    private final String toolName;
    private final boolean mutating;

    TaskOperation(String toolName, boolean mutating) {
        this.toolName = toolName;
        this.mutating = mutating;
    }

    public String toolName() {
        return toolName;
    }

    public boolean isMutating() {
        return mutating;
    }

    public static Optional<TaskOperation> fromToolName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (TaskOperation operation : values()) {
            if (operation.toolName.equals(normalized)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
