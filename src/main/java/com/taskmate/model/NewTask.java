package com.taskmate.model;

import java.time.LocalDateTime;
import java.util.Objects;

public record NewTask(String title, String description, TaskPriority priority, LocalDateTime dueDate) {

    public NewTask {
        Objects.requireNonNull(title, "title");
        priority = priority != null ? priority : TaskPriority.MEDIUM;
    }
}
