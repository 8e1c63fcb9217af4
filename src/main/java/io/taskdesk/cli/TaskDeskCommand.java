package io.taskdesk.cli;

import io.taskdesk.config.TaskDeskConfig;
import io.taskdesk.error.NotFoundException;
import io.taskdesk.error.ValidationException;
import io.taskdesk.model.DueWindow;
import io.taskdesk.model.SortMode;
import io.taskdesk.model.StatusFilter;
import io.taskdesk.model.Task;
import io.taskdesk.model.TaskDraft;
import io.taskdesk.model.TaskPage;
import io.taskdesk.observability.AuditLogger;
import io.taskdesk.query.TaskQuery;
import io.taskdesk.runtime.TaskDeskRuntime;
import io.taskdesk.storage.Database;
import io.taskdesk.util.Jsons;
import io.taskdesk.web.TaskWebServer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "taskdesk",
        mixinStandardHelpOptions = true,
        description = "Single-user task list manager",
        subcommands = {
                TaskDeskCommand.InitCommand.class,
                TaskDeskCommand.ServeWebCommand.class,
                TaskDeskCommand.AddCommand.class,
                TaskDeskCommand.ListCommand.class,
                TaskDeskCommand.EditCommand.class,
                TaskDeskCommand.ToggleCommand.class,
                TaskDeskCommand.DeleteCommand.class,
                TaskDeskCommand.SchemaMigrationsCommand.class,
                TaskDeskCommand.AuditVerifyCommand.class
        }
)
public final class TaskDeskCommand implements Runnable {
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID = 2;

    @Option(names = {"--root"}, description = "Data root directory (default: ${DEFAULT-VALUE})",
            defaultValue = "${env:TASKDESK_ROOT:-data}")
    String root;

    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public void run() {
        out.println("Use subcommands: init | serve-web | add | list | edit | toggle | delete | schema-migrations | audit-verify");
    }

    TaskDeskRuntime runtime() {
        TaskDeskRuntime runtime = new TaskDeskRuntime(TaskDeskConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create the data directory and bring the schema up to date")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Override
        public Integer call() {
            TaskDeskRuntime runtime = parent.runtime();
            parent.out.println("Initialized task database at: " + runtime.config().dbFile());
            return 0;
        }
    }

    @Command(name = "serve-web", description = "Serve the task list pages over HTTP")
    static final class ServeWebCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Option(names = {"--host"}, defaultValue = "${env:TASKDESK_HOST:-" + TaskDeskConfig.DEFAULT_HOST + "}",
                description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "${env:TASKDESK_PORT:-" + TaskDeskConfig.DEFAULT_PORT + "}",
                description = "Listen port")
        int port;

        @Option(names = {"--threads"}, defaultValue = "" + TaskDeskConfig.DEFAULT_HTTP_THREADS,
                description = "Request handler threads")
        int threads;

        @Override
        public Integer call() throws Exception {
            TaskDeskRuntime runtime = parent.runtime();
            TaskWebServer server = new TaskWebServer(runtime, host, port, threads);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                stopped.countDown();
            }, "taskdesk-shutdown"));
            int bound = server.start();
            parent.out.println("Task list available at http://" + host + ":" + bound + "/");
            stopped.await();
            return 0;
        }
    }

    @Command(name = "add", description = "Create a task")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--description"}, defaultValue = "", description = "Task description")
        String description;

        @Option(names = {"--priority"}, defaultValue = TaskDeskConfig.DEFAULT_PRIORITY, description = "high | medium | low")
        String priority;

        @Option(names = {"--category"}, defaultValue = TaskDeskConfig.DEFAULT_CATEGORY, description = "Category label")
        String category;

        @Option(names = {"--due"}, description = "Due date, YYYY-MM-DD")
        String due;

        @Override
        public Integer call() {
            try {
                long id = parent.runtime().addTask(TaskDraft.of(title, description, priority, category, due));
                parent.out.println(id);
                return 0;
            } catch (ValidationException e) {
                parent.err.println(e.getMessage());
                return EXIT_INVALID;
            }
        }
    }

    @Command(name = "list", description = "List tasks with the same filters as the web page")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Option(names = {"--category"}, defaultValue = TaskQuery.ALL)
        String category;

        @Option(names = {"--status"}, defaultValue = "all", description = "all | active | completed")
        String status;

        @Option(names = {"--priority"}, defaultValue = TaskQuery.ALL)
        String priority;

        @Option(names = {"--due"}, defaultValue = "all", description = "all | overdue | today | week")
        String due;

        @Option(names = {"--search", "-q"}, defaultValue = "")
        String search;

        @Option(names = {"--sort"}, defaultValue = "default", description = "default | due_date | created_at | priority | alpha")
        String sort;

        @Option(names = {"--page"}, defaultValue = "1")
        int page;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print the page as JSON")
        boolean json;

        @Override
        public Integer call() {
            TaskQuery query = new TaskQuery(
                    category,
                    StatusFilter.fromString(status),
                    priority,
                    DueWindow.fromString(due),
                    search,
                    SortMode.fromString(sort),
                    page
            );
            TaskPage result = parent.runtime().listTasks(query);
            if (json) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("tasks", result.rows());
                body.put("page", result.page());
                body.put("totalCount", result.totalCount());
                body.put("totalPages", result.totalPages());
                parent.out.println(Jsons.toJson(body));
                return 0;
            }
            for (Task task : result.rows()) {
                parent.out.printf("%5d [%s] %-6s %-10s %-10s %s%n",
                        task.id(),
                        task.completed() ? "x" : " ",
                        task.priority(),
                        task.category(),
                        task.dueDate() == null ? "-" : task.dueDate(),
                        task.title());
            }
            parent.out.println("page " + result.page() + "/" + result.totalPages() + ", " + result.totalCount() + " task(s)");
            return 0;
        }
    }

    @Command(name = "edit", description = "Overwrite every editable field of a task")
    static final class EditCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Parameters(index = "0", description = "Task id")
        long id;

        @Option(names = {"--title"}, required = true)
        String title;

        @Option(names = {"--description"}, defaultValue = "")
        String description;

        @Option(names = {"--priority"}, defaultValue = TaskDeskConfig.DEFAULT_PRIORITY)
        String priority;

        @Option(names = {"--category"}, defaultValue = TaskDeskConfig.DEFAULT_CATEGORY)
        String category;

        @Option(names = {"--due"}, description = "Due date, YYYY-MM-DD; omit to clear")
        String due;

        @Override
        public Integer call() {
            try {
                parent.runtime().editTask(id, TaskDraft.of(title, description, priority, category, due));
                return 0;
            } catch (ValidationException e) {
                parent.err.println(e.getMessage());
                return EXIT_INVALID;
            } catch (NotFoundException e) {
                parent.err.println(e.getMessage());
                return EXIT_FAILURE;
            }
        }
    }

    @Command(name = "toggle", description = "Flip the completed flag of a task")
    static final class ToggleCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Parameters(index = "0", description = "Task id")
        long id;

        @Override
        public Integer call() {
            try {
                TaskDeskRuntime runtime = parent.runtime();
                runtime.toggleTask(id);
                Task task = runtime.getTask(id).orElseThrow(() -> new NotFoundException(id));
                parent.out.println(task.completed() ? "completed" : "active");
                return 0;
            } catch (NotFoundException e) {
                parent.err.println(e.getMessage());
                return EXIT_FAILURE;
            }
        }
    }

    @Command(name = "delete", description = "Delete a task")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Parameters(index = "0", description = "Task id")
        long id;

        @Override
        public Integer call() {
            try {
                parent.runtime().deleteTask(id);
                return 0;
            } catch (NotFoundException e) {
                parent.err.println(e.getMessage());
                return EXIT_FAILURE;
            }
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            List<Database.SchemaMigrationRow> rows = parent.runtime().schemaMigrations(limit);
            for (Database.SchemaMigrationRow row : rows) {
                parent.out.println(row.version() + "  " + Instant.ofEpochMilli(row.appliedAtMs()) + "  " + row.description());
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Check the hash chain of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TaskDeskCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyOutcome outcome = parent.runtime().verifyAuditLog();
            parent.out.println(Jsons.toJson(outcome));
            return outcome.ok() ? 0 : EXIT_FAILURE;
        }
    }
}
