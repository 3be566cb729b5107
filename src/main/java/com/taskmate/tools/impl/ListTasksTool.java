package com.taskmate.tools.impl;

import com.taskmate.model.Task;
import com.taskmate.model.TaskQuery;
import com.taskmate.model.TaskStatus;
import com.taskmate.repository.TaskRepository;
import com.taskmate.tools.AiTool;
import com.taskmate.tools.TaskOperation;
import com.taskmate.tools.ToolArguments;
import com.taskmate.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ListTasksTool implements AiTool {

    private final TaskRepository repository;

    @Override
    public TaskOperation operation() {
        return TaskOperation.LIST;
    }

    @Override
    public String description() {
        return "List all tasks, newest first, optionally only those with the given status.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        ToolArguments.STATUS, Map.of("type", "string", "enum", List.of("todo", "in_progress", "completed", "archived"))
                ),
                "required", List.of()
        );
    }

    @Override
    public ToolResult execute(ToolArguments args) {
        TaskStatus status = args.optionalStatus().orElse(null);
        List<Task> tasks = repository.findAll(TaskQuery.byStatus(status));
        if (tasks.isEmpty()) {
            return ToolResult.success(operation(), "No tasks found", tasks);
        }
        return ToolResult.success(operation(), TaskDescriptions.listing("Tasks:", tasks), tasks);
    }
}
