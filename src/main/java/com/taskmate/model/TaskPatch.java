package com.taskmate.model;

import lombok.Builder;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partial update of a {@link Task}. A {@code null} component means "leave untouched".
 */
@Builder
public record TaskPatch(
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        LocalDateTime dueDate
) {

    public boolean isEmpty() {
        return title == null && description == null && status == null && priority == null && dueDate == null;
    }

    /**
     * Applies the present fields to {@code current}. Returns {@code current} itself when nothing
     * actually changes, otherwise a copy whose {@code updatedAt} is {@code now} (never earlier
     * than {@code createdAt}).
     */
    public Task applyTo(Task current, Instant now) {
        Task.TaskBuilder next = current.toBuilder();
        boolean changed = false;
        if (title != null && !title.equals(current.title())) {
            next.title(title);
            changed = true;
        }
        if (description != null && !description.equals(current.description())) {
            next.description(description);
            changed = true;
        }
        if (status != null && status != current.status()) {
            next.status(status);
            changed = true;
        }
        if (priority != null && priority != current.priority()) {
            next.priority(priority);
            changed = true;
        }
        if (dueDate != null && !dueDate.equals(current.dueDate())) {
            next.dueDate(dueDate);
            changed = true;
        }
        if (!changed) {
            return current;
        }
        Instant stamp = now.isBefore(current.createdAt()) ? current.createdAt() : now;
        return next.updatedAt(stamp).build();
    }

    /** Names of the fields that differ between {@code before} and {@code after}, in wire form. */
    public static List<String> changedFields(Task before, Task after) {
        List<String> changed = new ArrayList<>();
        if (!Objects.equals(before.title(), after.title())) changed.add("title");
        if (!Objects.equals(before.description(), after.description())) changed.add("description");
        if (before.status() != after.status()) changed.add("status");
        if (before.priority() != after.priority()) changed.add("priority");
        if (!Objects.equals(before.dueDate(), after.dueDate())) changed.add("due_date");
        return changed;
    }
}
