package com.taskmate.repository;

import com.taskmate.model.NewTask;
import com.taskmate.model.Task;
import com.taskmate.model.TaskPatch;
import com.taskmate.model.TaskPriority;
import com.taskmate.model.TaskQuery;
import com.taskmate.model.TaskStatus;
import com.taskmate.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcTaskRepositoryTests {

    private EmbeddedDatabase database;
    private MutableClock clock;
    private JdbcTaskRepository repository;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        clock = MutableClock.at("2026-10-19T08:00:00.123456789Z");
        repository = new JdbcTaskRepository(new NamedParameterJdbcTemplate(database), clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void insertedTaskReadsBackEqual() {
        Task created = repository.insert(new NewTask("plan trip", "book flights", TaskPriority.HIGH,
                LocalDateTime.of(2026, 10, 25, 23, 59, 59)));

        assertThat(created.id()).isPositive();
        assertThat(created.status()).isEqualTo(TaskStatus.TODO);
        assertThat(repository.findById(created.id())).contains(created);
    }

    @Test
    void updateAppliesOnlyPresentFields() {
        Task created = repository.insert(new NewTask("plan trip", "book flights", TaskPriority.HIGH, null));
        clock.advance(Duration.ofMinutes(1));

        Task updated = repository.update(created.id(), TaskPatch.builder().status(TaskStatus.IN_PROGRESS).build())
                .orElseThrow();

        assertThat(updated.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(updated.description()).isEqualTo("book flights");
        assertThat(updated.priority()).isEqualTo(TaskPriority.HIGH);
        assertThat(updated.updatedAt()).isAfter(created.updatedAt());
        assertThat(repository.findById(created.id())).contains(updated);
    }

    @Test
    void noOpUpdateLeavesRowUntouched() {
        Task created = repository.insert(new NewTask("plan trip", null, TaskPriority.LOW, null));
        clock.advance(Duration.ofMinutes(1));

        Task result = repository.update(created.id(), TaskPatch.builder().priority(TaskPriority.LOW).build()).orElseThrow();

        assertThat(result).isEqualTo(created);
        assertThat(repository.findById(created.id()).orElseThrow().updatedAt()).isEqualTo(created.updatedAt());
    }

    @Test
    void deleteRemovesRowAndIdIsNotReused() {
        Task first = repository.insert(new NewTask("first", null, null, null));

        assertThat(repository.delete(first.id())).contains(first);
        assertThat(repository.delete(first.id())).isEmpty();
        assertThat(repository.update(first.id(), TaskPatch.builder().title("x").build())).isEmpty();

        Task second = repository.insert(new NewTask("second", null, null, null));
        assertThat(second.id()).isGreaterThan(first.id());
    }

    @Test
    void findAllCombinesPredicatesAndOrdersNewestFirst() {
        Task low = repository.insert(new NewTask("low one", null, TaskPriority.LOW, null));
        clock.advance(Duration.ofSeconds(1));
        Task high = repository.insert(new NewTask("high one", null, TaskPriority.HIGH, null));
        clock.advance(Duration.ofSeconds(1));
        Task highDone = repository.insert(new NewTask("high done", null, TaskPriority.HIGH, null));
        repository.update(highDone.id(), TaskPatch.builder().status(TaskStatus.COMPLETED).build());

        assertThat(repository.findAll(TaskQuery.all())).extracting(Task::id)
                .containsExactly(highDone.id(), high.id(), low.id());
        assertThat(repository.findAll(new TaskQuery(TaskStatus.TODO, TaskPriority.HIGH))).extracting(Task::id)
                .containsExactly(high.id());
        assertThat(repository.findAll(TaskQuery.byStatus(TaskStatus.ARCHIVED))).isEmpty();
    }
}
