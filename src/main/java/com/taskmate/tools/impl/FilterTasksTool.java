package com.taskmate.tools.impl;

import com.taskmate.model.Task;
import com.taskmate.model.TaskQuery;
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
public class FilterTasksTool implements AiTool {

    private final TaskRepository repository;

    @Override
    public TaskOperation operation() {
        return TaskOperation.FILTER;
    }

    @Override
    public String description() {
        return "Filter tasks by priority and/or status; all given filters must match.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        ToolArguments.PRIORITY, Map.of("type", "string", "enum", List.of("low", "medium", "high")),
                        ToolArguments.STATUS, Map.of("type", "string", "enum", List.of("todo", "in_progress", "completed", "archived"))
                ),
                "required", List.of()
        );
    }

    @Override
    public ToolResult execute(ToolArguments args) {
        TaskQuery query = new TaskQuery(args.optionalStatus().orElse(null), args.optionalPriority().orElse(null));
        List<Task> tasks = repository.findAll(query);
        if (tasks.isEmpty()) {
            return ToolResult.success(operation(), "No tasks found with the specified filters", tasks);
        }
        return ToolResult.success(operation(), TaskDescriptions.listing("Filtered tasks:", tasks), tasks);
    }
}
