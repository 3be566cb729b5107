package com.taskmate.tools;

import java.util.Map;

public interface AiTool {

    TaskOperation operation();

    default String name() {
        return operation().toolName();
    }

    String description();

    /** JSON schema of the parameters, advertised to the model. */
    Map<String, Object> parametersSchema();

    /**
     * Runs the operation. Argument problems surface as
     * {@link com.taskmate.exception.ToolArgumentException}, missing tasks as
     * {@link com.taskmate.exception.TaskNotFoundException}.
     */
    ToolResult execute(ToolArguments args);
}
