package io.taskdesk.runtime;

import io.taskdesk.TestFiles;
import io.taskdesk.TickingClock;
import io.taskdesk.config.TaskDeskConfig;
import io.taskdesk.error.NotFoundException;
import io.taskdesk.model.DueWindow;
import io.taskdesk.model.Task;
import io.taskdesk.model.TaskDraft;
import io.taskdesk.model.TaskPage;
import io.taskdesk.query.TaskQuery;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

final class TaskDeskRuntimeTest {

    @Test
    void dueWindowsFollowTheRuntimeClock() throws Exception {
        Path root = Files.createTempDirectory("taskdesk-test-runtime-");
        try {
            TaskDeskRuntime runtime = new TaskDeskRuntime(
                    TaskDeskConfig.fromRoot(root.toString()), TickingClock.at("2024-01-05T12:00:00Z"));
            runtime.init();
            Assertions.assertEquals(LocalDate.of(2024, 1, 5), runtime.today());

            runtime.addTask(TaskDraft.of("today", "", "low", "work", "2024-01-05"));
            runtime.addTask(TaskDraft.of("yesterday", "", "low", "work", "2024-01-04"));

            TaskPage overdue = runtime.listTasks(new TaskQuery(null, null, null, DueWindow.OVERDUE, null, null, 1));
            Assertions.assertEquals(1, overdue.totalCount());
            Assertions.assertEquals("yesterday", overdue.rows().get(0).title());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void mutationsAreAudited() throws Exception {
        Path root = Files.createTempDirectory("taskdesk-test-runtime-audit-");
        try {
            TaskDeskConfig config = TaskDeskConfig.fromRoot(root.toString());
            TaskDeskRuntime runtime = new TaskDeskRuntime(config, TickingClock.at("2024-01-05T12:00:00Z"));
            runtime.init();

            long id = runtime.addTask(TaskDraft.of("Pay rent", "", "high", "home", null));
            runtime.toggleTask(id);
            runtime.editTask(id, TaskDraft.of("Pay rent now", "", "high", "home", null));
            Task task = runtime.getTask(id).orElseThrow();
            Assertions.assertTrue(task.completed());
            Assertions.assertEquals("Pay rent now", task.title());
            runtime.deleteTask(id);
            Assertions.assertThrows(NotFoundException.class, () -> runtime.deleteTask(id));

            List<String> lines = Files.readAllLines(config.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(5, lines.size());
            Assertions.assertTrue(lines.get(0).contains("task.create"));
            Assertions.assertTrue(lines.get(4).contains("\"result\":\"not_found\""));
            Assertions.assertTrue(runtime.verifyAuditLog().ok());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void operationsRequireInit() throws Exception {
        Path root = Files.createTempDirectory("taskdesk-test-runtime-noinit-");
        try {
            TaskDeskRuntime runtime = new TaskDeskRuntime(TaskDeskConfig.fromRoot(root.toString()));
            Assertions.assertThrows(IllegalStateException.class, runtime::verifyAuditLog);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void auditRowsRecordDefaultedFields() throws Exception {
        Path root = Files.createTempDirectory("taskdesk-test-runtime-defaults-");
        try {
            TaskDeskConfig config = TaskDeskConfig.fromRoot(root.toString());
            TaskDeskRuntime runtime = new TaskDeskRuntime(config, TickingClock.at("2024-01-05T12:00:00Z"));
            runtime.init();

            long id = runtime.addTask(TaskDraft.of("Stretch", "", " ", "", null));
            runtime.editTask(id, TaskDraft.of("Stretch more", "", "", " ", null));

            List<String> lines = Files.readAllLines(config.auditFile(), StandardCharsets.UTF_8);
            for (String line : lines) {
                Assertions.assertTrue(line.contains("\"priority\":\"medium\""), line);
                Assertions.assertTrue(line.contains("\"category\":\"personal\""), line);
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failedAuditWriteDoesNotFailAppliedMutation() throws Exception {
        Path root = Files.createTempDirectory("taskdesk-test-runtime-audit-broken-");
        try {
            TaskDeskConfig config = TaskDeskConfig.fromRoot(root.toString());
            TaskDeskRuntime runtime = new TaskDeskRuntime(config, TickingClock.at("2024-01-05T12:00:00Z"));
            runtime.init();
            Files.delete(config.auditFile());
            Files.createDirectory(config.auditFile());

            long id = runtime.addTask(TaskDraft.of("Pay rent", "", "high", "home", null));
            runtime.toggleTask(id);
            runtime.editTask(id, TaskDraft.of("Pay rent today", "", "high", "home", null));

            TaskPage all = runtime.listTasks(TaskQuery.defaults());
            Assertions.assertEquals(1, all.totalCount());
            Assertions.assertEquals("Pay rent today", all.rows().get(0).title());
            Assertions.assertTrue(all.rows().get(0).completed());

            runtime.deleteTask(id);
            Assertions.assertTrue(runtime.getTask(id).isEmpty());
            Assertions.assertThrows(NotFoundException.class, () -> runtime.toggleTask(id));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
