package io.taskdesk.runtime;

import io.taskdesk.config.TaskDeskConfig;
import io.taskdesk.error.NotFoundException;
import io.taskdesk.model.Task;
import io.taskdesk.model.TaskDraft;
import io.taskdesk.model.TaskPage;
import io.taskdesk.observability.AuditLogger;
import io.taskdesk.query.QueryCompiler;
import io.taskdesk.query.QueryPlan;
import io.taskdesk.query.TaskQuery;
import io.taskdesk.storage.Database;
import io.taskdesk.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TaskDeskRuntime {
    private static final Logger log = LoggerFactory.getLogger(TaskDeskRuntime.class);

    private final TaskDeskConfig config;
    private final Clock clock;
    private final Database database;
    private final TaskStore store;
    private final QueryCompiler compiler;
    private volatile AuditLogger auditLogger;

    public TaskDeskRuntime(TaskDeskConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public TaskDeskRuntime(TaskDeskConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.database = new Database(config);
        this.store = new TaskStore(database, clock);
        this.compiler = new QueryCompiler(TaskDeskConfig.PAGE_SIZE);
    }

    /**
     * Prepares the data directory and schema. Must run once before any other operation.
     */
    public void init() {
        database.init();
        auditLogger = new AuditLogger(config.auditFile(), clock);
    }

    public TaskDeskConfig config() {
        return config;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public QueryPlan plan(TaskQuery query) {
        return compiler.compile(query, today());
    }

    public TaskPage listTasks(TaskQuery query) {
        QueryPlan plan = plan(query);
        TaskPage page = store.list(plan);
        log.debug("Listed {} of {} tasks (page {}/{})", page.rows().size(), page.totalCount(), page.page(), page.totalPages());
        return page;
    }

    public Optional<Task> getTask(long id) {
        return store.find(id);
    }

    public long addTask(TaskDraft draft) {
        long id = store.create(draft);
        log.info("Created task {}", id);
        audit("task.create", id, "ok", draftDetails(draft.normalized()));
        return id;
    }

    public void editTask(long id, TaskDraft draft) {
        try {
            store.update(id, draft);
        } catch (NotFoundException e) {
            audit("task.update", id, "not_found", Map.of());
            throw e;
        }
        log.info("Updated task {}", id);
        audit("task.update", id, "ok", draftDetails(draft.normalized()));
    }

    public void toggleTask(long id) {
        try {
            store.toggleComplete(id);
        } catch (NotFoundException e) {
            audit("task.toggle", id, "not_found", Map.of());
            throw e;
        }
        log.info("Toggled task {}", id);
        audit("task.toggle", id, "ok", Map.of());
    }

    public void deleteTask(long id) {
        try {
            store.delete(id);
        } catch (NotFoundException e) {
            audit("task.delete", id, "not_found", Map.of());
            throw e;
        }
        log.info("Deleted task {}", id);
        audit("task.delete", id, "ok", Map.of());
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public AuditLogger.VerifyOutcome verifyAuditLog() {
        return requireAudit().verify();
    }

    /**
     * Records a mutation that has already been applied. A failing audit write is logged and does
     * not fail the caller, whose change is committed either way.
     */
    private void audit(String action, long taskId, String result, Map<String, Object> details) {
        AuditLogger logger = requireAudit();
        try {
            logger.log(AuditLogger.AuditEvent.of(action, taskId, result, details));
        } catch (RuntimeException e) {
            log.error("Failed to write audit row {} for task {} ({})", action, taskId, result, e);
        }
    }

    private AuditLogger requireAudit() {
        AuditLogger current = auditLogger;
        if (current == null) {
            throw new IllegalStateException("Runtime not initialized; call init() first");
        }
        return current;
    }

    private static Map<String, Object> draftDetails(TaskDraft draft) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", draft.title());
        details.put("priority", draft.priority());
        details.put("category", draft.category());
        details.put("due_date", draft.dueDate() == null ? null : draft.dueDate().toString());
        return details;
    }
}
