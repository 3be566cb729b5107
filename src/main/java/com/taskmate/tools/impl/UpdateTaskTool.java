package com.taskmate.tools.impl;

import com.taskmate.exception.TaskNotFoundException;
import com.taskmate.model.Task;
import com.taskmate.model.TaskPatch;
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
public class UpdateTaskTool implements AiTool {

    private final TaskRepository repository;

    @Override
    public TaskOperation operation() {
        return TaskOperation.UPDATE;
    }

    @Override
    public String description() {
        return "Update a task by ID. Only the fields provided are changed.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        ToolArguments.TASK_ID, Map.of("type", "integer"),
                        ToolArguments.TITLE, Map.of("type", "string"),
                        ToolArguments.DESCRIPTION, Map.of("type", "string"),
                        ToolArguments.STATUS, Map.of("type", "string", "enum", List.of("todo", "in_progress", "completed", "archived")),
                        ToolArguments.PRIORITY, Map.of("type", "string", "enum", List.of("low", "medium", "high")),
                        ToolArguments.DUE_DATE, Map.of("type", "string", "description", "ISO-8601 date or date-time")
                ),
                "required", List.of(ToolArguments.TASK_ID)
        );
    }

    @Override
    public ToolResult execute(ToolArguments args) {
        long taskId = args.requireTaskId();
        TaskPatch patch = TaskPatch.builder()
                .title(args.optionalText(ToolArguments.TITLE).orElse(null))
                .description(args.optionalText(ToolArguments.DESCRIPTION).orElse(null))
                .status(args.optionalStatus().orElse(null))
                .priority(args.optionalPriority().orElse(null))
                .dueDate(args.optionalDueDate().orElse(null))
                .build();

        Task before = repository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (patch.isEmpty()) {
            return ToolResult.success(operation(), "No fields to change were given; task " + taskId + " is unchanged.", before);
        }

        Task after = repository.update(taskId, patch).orElseThrow(() -> new TaskNotFoundException(taskId));
        List<String> changed = TaskPatch.changedFields(before, after);
        if (changed.isEmpty()) {
            return ToolResult.success(operation(), "Task " + taskId + " already has those values; nothing changed.", after);
        }
        log.info("Updated task id={} fields={}", taskId, changed);
        return ToolResult.success(operation(),
                "Task " + taskId + " updated successfully (" + String.join(", ", changed) + "). Now: "
                        + TaskDescriptions.line(after),
                after);
    }
}
