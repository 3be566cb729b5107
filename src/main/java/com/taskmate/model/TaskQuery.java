package com.taskmate.model;

/**
 * Listing predicates; each non-null component must match (logical AND).
 */
public record TaskQuery(TaskStatus status, TaskPriority priority) {

    private static final TaskQuery ALL = new TaskQuery(null, null);

    public static TaskQuery all() {
        return ALL;
    }

    public static TaskQuery byStatus(TaskStatus status) {
        return new TaskQuery(status, null);
    }

    public boolean matches(Task task) {
        return (status == null || task.status() == status)
                && (priority == null || task.priority() == priority);
    }
}
