package com.taskmate.tools.impl;

import com.taskmate.model.Task;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

final class TaskDescriptions {

    private static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private TaskDescriptions() {
    }

    static String line(Task task) {
        StringBuilder builder = new StringBuilder()
                .append("ID: ").append(task.id())
                .append(", Title: ").append(task.title())
                .append(", Status: ").append(task.status().wireValue())
                .append(", Priority: ").append(task.priority().wireValue());
        if (task.dueDate() != null) {
            builder.append(", Due: ").append(DUE_FORMAT.format(task.dueDate()));
        }
        if (task.description() != null && !task.description().isBlank()) {
            builder.append(", Description: ").append(task.description());
        }
        return builder.toString();
    }

    static String listing(String heading, List<Task> tasks) {
        return tasks.stream()
                .map(TaskDescriptions::line)
                .collect(Collectors.joining("\n", heading + "\n", ""));
    }
}
