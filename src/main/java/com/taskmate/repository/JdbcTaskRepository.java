package com.taskmate.repository;

import com.taskmate.model.NewTask;
import com.taskmate.model.Task;
import com.taskmate.model.TaskPatch;
import com.taskmate.model.TaskPriority;
import com.taskmate.model.TaskQuery;
import com.taskmate.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "taskmate.store.storage", havingValue = "database")
@Slf4j
public class JdbcTaskRepository implements TaskRepository {

    private static final String BASE_SELECT = """
            SELECT id, title, description, status, priority, due_date, created_at, updated_at
            FROM tasks
            """;

    private static final String ORDER_NEWEST_FIRST = " ORDER BY created_at DESC, id DESC";

    private static final RowMapper<Task> ROW_MAPPER = new TaskRowMapper();

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcTaskRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Task insert(NewTask request) {
        Instant now = now();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("title", request.title())
                .addValue("description", request.description())
                .addValue("status", TaskStatus.TODO.wireValue())
                .addValue("priority", request.priority().wireValue())
                .addValue("dueDate", request.dueDate() != null ? Timestamp.valueOf(request.dueDate()) : null)
                .addValue("createdAt", Timestamp.from(now))
                .addValue("updatedAt", Timestamp.from(now));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update("""
                INSERT INTO tasks (title, description, status, priority, due_date, created_at, updated_at)
                VALUES (:title, :description, :status, :priority, :dueDate, :createdAt, :updatedAt)
                """, params, keyHolder, new String[]{"id"});

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Database did not return a generated id for the new task");
        }
        log.debug("Inserted task id={} title='{}'", key.longValue(), request.title());
        return Task.builder()
                .id(key.longValue())
                .title(request.title())
                .description(request.description())
                .status(TaskStatus.TODO)
                .priority(request.priority())
                .dueDate(request.dueDate())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Override
    public Optional<Task> findById(long id) {
        List<Task> rows = jdbcTemplate.query(BASE_SELECT + " WHERE id = :id",
                new MapSqlParameterSource("id", id), ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    @Transactional
    public Optional<Task> update(long id, TaskPatch patch) {
        List<Task> locked = jdbcTemplate.query(BASE_SELECT + " WHERE id = :id FOR UPDATE",
                new MapSqlParameterSource("id", id), ROW_MAPPER);
        if (locked.isEmpty()) {
            log.debug("Update skipped; task id={} not present", id);
            return Optional.empty();
        }
        Task current = locked.get(0);
        Task next = patch.applyTo(current, now());
        if (next == current) {
            return Optional.of(current);
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("title", next.title())
                .addValue("description", next.description())
                .addValue("status", next.status().wireValue())
                .addValue("priority", next.priority().wireValue())
                .addValue("dueDate", next.dueDate() != null ? Timestamp.valueOf(next.dueDate()) : null)
                .addValue("updatedAt", Timestamp.from(next.updatedAt()));
        jdbcTemplate.update("""
                UPDATE tasks
                SET title = :title, description = :description, status = :status, priority = :priority,
                    due_date = :dueDate, updated_at = :updatedAt
                WHERE id = :id
                """, params);
        return Optional.of(next);
    }

    @Override
    @Transactional
    public Optional<Task> delete(long id) {
        Optional<Task> existing = findById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        int deleted = jdbcTemplate.update("DELETE FROM tasks WHERE id = :id", new MapSqlParameterSource("id", id));
        log.debug("Delete task id={} removedRows={}", id, deleted);
        return deleted > 0 ? existing : Optional.empty();
    }

    @Override
    public List<Task> findAll(TaskQuery query) {
        TaskQuery effective = query != null ? query : TaskQuery.all();
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> clauses = new ArrayList<>();
        if (effective.status() != null) {
            clauses.add("status = :status");
            params.addValue("status", effective.status().wireValue());
        }
        if (effective.priority() != null) {
            clauses.add("priority = :priority");
            params.addValue("priority", effective.priority().wireValue());
        }
        String where = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        return jdbcTemplate.query(BASE_SELECT + where + ORDER_NEWEST_FIRST, params, ROW_MAPPER);
    }

    // TIMESTAMP columns keep microseconds; trimming here keeps returned tasks equal to re-read ones.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp due = rs.getTimestamp("due_date");
            String status = rs.getString("status");
            String priority = rs.getString("priority");
            return Task.builder()
                    .id(rs.getLong("id"))
                    .title(rs.getString("title"))
                    .description(rs.getString("description"))
                    .status(TaskStatus.parse(status)
                            .orElseThrow(() -> new SQLException("Unknown task status in row: " + status)))
                    .priority(TaskPriority.parse(priority)
                            .orElseThrow(() -> new SQLException("Unknown task priority in row: " + priority)))
                    .dueDate(due != null ? due.toLocalDateTime() : null)
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
