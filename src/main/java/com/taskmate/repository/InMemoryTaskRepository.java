package com.taskmate.repository;

import com.taskmate.model.NewTask;
import com.taskmate.model.Task;
import com.taskmate.model.TaskPatch;
import com.taskmate.model.TaskQuery;
import com.taskmate.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Repository
@ConditionalOnProperty(name = "taskmate.store.storage", havingValue = "in-memory", matchIfMissing = true)
@Slf4j
public class InMemoryTaskRepository implements TaskRepository {

    static final Comparator<Task> NEWEST_FIRST = Comparator.comparing(Task::createdAt)
            .thenComparingLong(Task::id)
            .reversed();

    private final Map<Long, Task> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryTaskRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Task insert(NewTask request) {
        long id = sequence.incrementAndGet();
        Instant now = clock.instant();
        Task task = Task.builder()
                .id(id)
                .title(request.title())
                .description(request.description())
                .status(TaskStatus.TODO)
                .priority(request.priority())
                .dueDate(request.dueDate())
                .createdAt(now)
                .updatedAt(now)
                .build();
        tasks.put(id, task);
        log.debug("Inserted task id={} title='{}'", id, task.title());
        return task;
    }

    @Override
    public Optional<Task> findById(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public Optional<Task> update(long id, TaskPatch patch) {
        AtomicReference<Task> result = new AtomicReference<>();
        tasks.computeIfPresent(id, (key, current) -> {
            Task next = patch.applyTo(current, clock.instant());
            result.set(next);
            return next;
        });
        if (result.get() == null) {
            log.debug("Update skipped; task id={} not present", id);
        }
        return Optional.ofNullable(result.get());
    }

    @Override
    public Optional<Task> delete(long id) {
        Task removed = tasks.remove(id);
        log.debug("Delete task id={} removed={}", id, removed != null);
        return Optional.ofNullable(removed);
    }

    @Override
    public List<Task> findAll(TaskQuery query) {
        TaskQuery effective = query != null ? query : TaskQuery.all();
        return tasks.values().stream()
                .filter(effective::matches)
                .sorted(NEWEST_FIRST)
                .toList();
    }
}
