package com.taskmate.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * A unit of work on the shared board.
 *
 * <p>Serialized with snake_case names ({@code due_date}, {@code created_at}, {@code updated_at}),
 * which is the shape every connected client receives in {@code initial_tasks} and
 * {@code task_update} frames.</p>
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Task(
        long id,
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        LocalDateTime dueDate,
        Instant createdAt,
        Instant updatedAt
) {
}
