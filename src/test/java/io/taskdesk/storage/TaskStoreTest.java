package io.taskdesk.storage;

import io.taskdesk.TestFiles;
import io.taskdesk.TickingClock;
import io.taskdesk.config.TaskDeskConfig;
import io.taskdesk.error.NotFoundException;
import io.taskdesk.error.ValidationException;
import io.taskdesk.model.Task;
import io.taskdesk.model.TaskDraft;
import io.taskdesk.model.TaskPage;
import io.taskdesk.query.QueryCompiler;
import io.taskdesk.query.TaskQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

final class TaskStoreTest {
    private Path root;
    private TickingClock clock;
    private TaskStore store;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("taskdesk-test-store-");
        Database db = new Database(TaskDeskConfig.fromRoot(root.toString()));
        db.init();
        clock = TickingClock.at("2024-01-05T09:00:00Z");
        store = new TaskStore(db, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        TestFiles.deleteRecursively(root);
    }

    @Test
    void createThenListReturnsSuppliedFields() {
        long id = store.create(TaskDraft.of("Pay rent", "before the 10th", "high", "home", "2024-01-10"));

        TaskPage page = store.list(new QueryCompiler(50).compile(TaskQuery.defaults(), LocalDate.of(2024, 1, 5)));
        Assertions.assertEquals(1, page.totalCount());
        Task task = page.rows().get(0);
        Assertions.assertEquals(id, task.id());
        Assertions.assertEquals("Pay rent", task.title());
        Assertions.assertEquals("before the 10th", task.description());
        Assertions.assertEquals("high", task.priority());
        Assertions.assertEquals("home", task.category());
        Assertions.assertEquals(LocalDate.of(2024, 1, 10), task.dueDate());
        Assertions.assertFalse(task.completed());
        Assertions.assertEquals(LocalDateTime.of(2024, 1, 5, 9, 0), task.createdAt());
        Assertions.assertEquals(task.createdAt(), task.updatedAt());
    }

    @Test
    void createAppliesDefaults() {
        long id = store.create(TaskDraft.of("Call mom", null, null, null, null));
        Task task = store.find(id).orElseThrow();
        Assertions.assertEquals("", task.description());
        Assertions.assertEquals("medium", task.priority());
        Assertions.assertEquals("personal", task.category());
        Assertions.assertNull(task.dueDate());
    }

    @Test
    void idsAreNeverReused() {
        long first = store.create(TaskDraft.of("one", "", "low", "work", null));
        store.delete(first);
        long second = store.create(TaskDraft.of("two", "", "low", "work", null));
        Assertions.assertTrue(second > first);
    }

    @Test
    void createRejectsBlankTitle() {
        Assertions.assertThrows(ValidationException.class,
                () -> store.create(TaskDraft.of("  ", "", "low", "work", null)));
    }

    @Test
    void updateOverwritesFieldsAndRefreshesUpdatedAt() {
        long id = store.create(TaskDraft.of("Draft", "old", "low", "work", "2024-02-01"));
        clock.advance(Duration.ofMinutes(5));

        store.update(id, TaskDraft.of("Final", "", "high", "personal", null));

        Task task = store.find(id).orElseThrow();
        Assertions.assertEquals("Final", task.title());
        Assertions.assertEquals("", task.description());
        Assertions.assertEquals("high", task.priority());
        Assertions.assertEquals("personal", task.category());
        Assertions.assertNull(task.dueDate());
        Assertions.assertEquals(LocalDateTime.of(2024, 1, 5, 9, 0), task.createdAt());
        Assertions.assertEquals(LocalDateTime.of(2024, 1, 5, 9, 5), task.updatedAt());
    }

    @Test
    void toggleTwiceRestoresOriginalState() {
        long id = store.create(TaskDraft.of("Laundry", "", "low", "home", null));
        clock.advance(Duration.ofSeconds(1));
        store.toggleComplete(id);
        Assertions.assertTrue(store.find(id).orElseThrow().completed());
        clock.advance(Duration.ofSeconds(1));
        store.toggleComplete(id);
        Task task = store.find(id).orElseThrow();
        Assertions.assertFalse(task.completed());
        Assertions.assertEquals(LocalDateTime.of(2024, 1, 5, 9, 0, 2), task.updatedAt());
    }

    @Test
    void updatedAtNeverPrecedesCreatedAtWhenClockStepsBack() {
        long id = store.create(TaskDraft.of("Clock skew", "", "low", "home", null));
        clock.advance(Duration.ofHours(-2));
        store.toggleComplete(id);
        store.update(id, TaskDraft.of("Clock skew 2", "", "low", "home", null));

        Task task = store.find(id).orElseThrow();
        Assertions.assertFalse(task.updatedAt().isBefore(task.createdAt()));
    }

    @Test
    void missingIdsRaiseNotFound() {
        Assertions.assertThrows(NotFoundException.class, () -> store.toggleComplete(404L));
        Assertions.assertThrows(NotFoundException.class,
                () -> store.update(404L, TaskDraft.of("x", "", "low", "work", null)));
        NotFoundException e = Assertions.assertThrows(NotFoundException.class, () -> store.delete(404L));
        Assertions.assertEquals(404L, e.taskId());
        Assertions.assertTrue(store.find(404L).isEmpty());
    }

    @Test
    void deleteRemovesRow() {
        long id = store.create(TaskDraft.of("Temporary", "", "low", "work", null));
        store.delete(id);
        Assertions.assertTrue(store.find(id).isEmpty());
        Assertions.assertThrows(NotFoundException.class, () -> store.delete(id));
    }
}
