package com.taskmate.tools.impl;

import com.taskmate.exception.TaskNotFoundException;
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
public class DeleteTaskTool implements AiTool {

    private final TaskRepository repository;

    @Override
    public TaskOperation operation() {
        return TaskOperation.DELETE;
    }

    @Override
    public String description() {
        return "Delete a task by ID.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(ToolArguments.TASK_ID, Map.of("type", "integer")),
                "required", List.of(ToolArguments.TASK_ID)
        );
    }

    @Override
    public ToolResult execute(ToolArguments args) {
        long taskId = args.requireTaskId();
        Task removed = repository.delete(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        log.info("Deleted task id={}", taskId);
        return ToolResult.success(operation(), "Task " + taskId + " ('" + removed.title() + "') deleted successfully.", taskId);
    }
}
