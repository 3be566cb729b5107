package com.taskmate.tools.impl;

import com.taskmate.model.NewTask;
import com.taskmate.model.Task;
import com.taskmate.repository.TaskRepository;
import com.taskmate.tools.AiTool;
import com.taskmate.tools.TaskOperation;
import com.taskmate.tools.ToolArguments;
import com.taskmate.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class CreateTaskTool implements AiTool {

    private final TaskRepository repository;

    @Override
    public TaskOperation operation() {
        return TaskOperation.CREATE;
    }

    @Override
    public String description() {
        return "Create a new task. Status starts as todo; priority defaults to medium.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        ToolArguments.TITLE, Map.of("type", "string", "description", "Short title, about 4-6 words"),
                        ToolArguments.DESCRIPTION, Map.of("type", "string", "description", "Details such as items, reasons or timing"),
                        ToolArguments.PRIORITY, Map.of("type", "string", "enum", List.of("low", "medium", "high")),
                        ToolArguments.DUE_DATE, Map.of("type", "string", "description", "ISO-8601 date or date-time")
                ),
                "required", List.of(ToolArguments.TITLE)
        );
    }

    @Override
    public ToolResult execute(ToolArguments args) {
        NewTask request = new NewTask(
                args.requireText(ToolArguments.TITLE),
                args.optionalText(ToolArguments.DESCRIPTION).orElse(null),
                args.priorityOrMedium(),
                args.optionalDueDate().orElse(null)
        );
        Task task = repository.insert(request);
        log.info("Created task id={} priority={}", task.id(), task.priority().wireValue());
        return ToolResult.success(operation(),
                "Task '" + task.title() + "' created successfully with ID " + task.id()
                        + " (status: " + task.status().wireValue() + ", priority: " + task.priority().wireValue() + ").",
                task);
    }
}
