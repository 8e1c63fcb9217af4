package io.taskdesk.storage;

import io.taskdesk.error.NotFoundException;
import io.taskdesk.error.StorageException;
import io.taskdesk.model.Task;
import io.taskdesk.model.TaskDraft;
import io.taskdesk.model.TaskPage;
import io.taskdesk.query.QueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative persistence for tasks. Every write is a single statement, so it is applied
 * entirely or not at all; concurrent writers to the same row resolve last-write-wins.
 */
public final class TaskStore {
    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);
    private static final String SELECT_TASK = "SELECT " + QueryPlan.TASK_COLUMNS + " FROM todos WHERE id=?";

    private final Database database;
    private final Clock clock;

    public TaskStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public TaskStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public long create(TaskDraft draft) {
        TaskDraft d = draft.normalized();
        String now = Timestamps.format(Timestamps.now(clock));
        String sql = "INSERT INTO todos(title,description,priority,category,completed,created_at,due_date,updated_at) VALUES(?,?,?,?,0,?,?,?)";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, d.title());
            ps.setString(2, d.description());
            ps.setString(3, d.priority());
            ps.setString(4, d.category());
            ps.setString(5, now);
            setDate(ps, 6, d.dueDate());
            ps.setString(7, now);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StorageException("Insert returned no generated id", null);
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to create task", e);
        }
    }

    public void update(long id, TaskDraft draft) {
        TaskDraft d = draft.normalized();
        String sql = """
                UPDATE todos SET title=?, description=?, priority=?, category=?, due_date=?,
                    updated_at=MAX(COALESCE(updated_at, ''), ?)
                WHERE id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, d.title());
            ps.setString(2, d.description());
            ps.setString(3, d.priority());
            ps.setString(4, d.category());
            setDate(ps, 5, d.dueDate());
            ps.setString(6, Timestamps.format(Timestamps.now(clock)));
            ps.setLong(7, id);
            requireRow(ps.executeUpdate(), id);
        } catch (SQLException e) {
            throw new StorageException("Failed to update task " + id, e);
        }
    }

    public void toggleComplete(long id) {
        String sql = "UPDATE todos SET completed = NOT completed, updated_at=MAX(COALESCE(updated_at, ''), ?) WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(Timestamps.now(clock)));
            ps.setLong(2, id);
            requireRow(ps.executeUpdate(), id);
        } catch (SQLException e) {
            throw new StorageException("Failed to toggle task " + id, e);
        }
    }

    public void delete(long id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM todos WHERE id=?")) {
            ps.setLong(1, id);
            requireRow(ps.executeUpdate(), id);
        } catch (SQLException e) {
            throw new StorageException("Failed to delete task " + id, e);
        }
    }

    public Optional<Task> find(long id) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(SELECT_TASK)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readTask(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read task " + id, e);
        }
    }

    /**
     * Runs the page query and the count query of {@code plan} in one read transaction so both
     * observe the same committed state.
     */
    public TaskPage list(QueryPlan plan) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                List<Task> rows = new ArrayList<>();
                try (PreparedStatement ps = c.prepareStatement(plan.rowSql())) {
                    bind(ps, plan.rowParams());
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            rows.add(readTask(rs));
                        }
                    }
                }
                long total;
                try (PreparedStatement ps = c.prepareStatement(plan.countSql())) {
                    bind(ps, plan.countParams());
                    try (ResultSet rs = ps.executeQuery()) {
                        total = rs.next() ? rs.getLong(1) : 0L;
                    }
                }
                c.commit();
                return new TaskPage(rows, total, plan.page(), plan.pageSize());
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list tasks", e);
        }
    }

    private static void requireRow(int updated, long id) {
        if (updated == 0) {
            throw new NotFoundException(id);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static void setDate(PreparedStatement ps, int index, LocalDate value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value.toString());
        }
    }

    private static LocalDate readDueDate(long id, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            log.warn("Task {} has unreadable due date '{}', treating it as undated", id, raw);
            return null;
        }
    }

    private static Task readTask(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        LocalDateTime createdAt = Timestamps.parse(rs.getString("created_at"));
        LocalDateTime updatedAt = Timestamps.parse(rs.getString("updated_at"));
        String description = rs.getString("description");
        return new Task(
                id,
                rs.getString("title"),
                description == null ? "" : description,
                rs.getString("priority"),
                rs.getString("category"),
                rs.getInt("completed") != 0,
                createdAt,
                readDueDate(id, rs.getString("due_date")),
                updatedAt == null ? createdAt : updatedAt
        );
    }
}
