package com.taskmate.repository;

import com.taskmate.model.NewTask;
import com.taskmate.model.Task;
import com.taskmate.model.TaskPatch;
import com.taskmate.model.TaskQuery;

import java.util.List;
import java.util.Optional;

/**
 * Task store adapter. Every operation is atomic for the record it touches; listings are ordered
 * by {@code created_at} descending (newest first, ties broken by id descending).
 */
public interface TaskRepository {

    Task insert(NewTask task);

    Optional<Task> findById(long id);

    /**
     * Applies {@code patch} atomically. Empty when no task has that id. When the patch changes
     * nothing the stored task is returned as is, {@code updated_at} included.
     */
    Optional<Task> update(long id, TaskPatch patch);

    Optional<Task> delete(long id);

    List<Task> findAll(TaskQuery query);
}
