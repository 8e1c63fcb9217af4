package io.taskdesk.storage;

import io.taskdesk.config.TaskDeskConfig;
import io.taskdesk.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Owns the SQLite file and its schema.
 *
 * <p>{@link #init()} is additive and idempotent: missing columns are detected through the
 * table catalog and added, applied migrations are recorded and skipped. Nothing is dropped
 * or renamed.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "taskdesk.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5000;

    // Columns that older schema versions may lack, with constant-only defaults.
    private static final Map<String, String> TODO_COLUMNS = new LinkedHashMap<>();

    static {
        TODO_COLUMNS.put("description", "TEXT");
        TODO_COLUMNS.put("priority", "TEXT DEFAULT 'medium'");
        TODO_COLUMNS.put("category", "TEXT DEFAULT 'personal'");
        TODO_COLUMNS.put("completed", "BOOLEAN NOT NULL DEFAULT 0");
        TODO_COLUMNS.put("created_at", "TIMESTAMP");
        TODO_COLUMNS.put("due_date", "DATE");
        TODO_COLUMNS.put("updated_at", "TIMESTAMP");
    }

    private final TaskDeskConfig config;
    private final String jdbcUrl;

    public Database(TaskDeskConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
        log.info("Database ready at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize data directories under " + config.rootDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS todos (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        title TEXT NOT NULL,
                        description TEXT,
                        priority TEXT DEFAULT 'medium',
                        category TEXT DEFAULT 'personal',
                        completed BOOLEAN NOT NULL DEFAULT 0,
                        created_at TIMESTAMP,
                        due_date DATE,
                        updated_at TIMESTAMP
                    )
                    """);
            ensureTodoColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureTodoColumns(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "todos");
        try (Statement st = conn.createStatement()) {
            for (Map.Entry<String, String> column : TODO_COLUMNS.entrySet()) {
                if (!columns.contains(column.getKey())) {
                    st.execute("ALTER TABLE todos ADD COLUMN " + column.getKey() + " " + column.getValue());
                    log.info("Added missing column todos.{}", column.getKey());
                }
            }
            // SQLite cannot add a column defaulting to CURRENT_TIMESTAMP, so legacy rows are backfilled.
            String now = Timestamps.format(Timestamps.nowUtc());
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE todos SET created_at=COALESCE(created_at, updated_at, ?) WHERE created_at IS NULL")) {
                ps.setString(1, now);
                ps.executeUpdate();
            }
            st.execute("UPDATE todos SET updated_at=created_at WHERE updated_at IS NULL OR updated_at < created_at");
            int cleared = st.executeUpdate(
                    "UPDATE todos SET due_date=NULL WHERE due_date IS NOT NULL AND date(due_date) IS NOT due_date");
            if (cleared > 0) {
                log.warn("Cleared {} due date(s) not in YYYY-MM-DD form", cleared);
            }
        }
    }

    static Set<String> tableColumns(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20240101_001_filter_indexes",
                "Index the columns used by listing filters",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_todos_completed ON todos(completed)",
                        "CREATE INDEX IF NOT EXISTS idx_todos_priority ON todos(priority)",
                        "CREATE INDEX IF NOT EXISTS idx_todos_due_date ON todos(due_date)",
                        "CREATE INDEX IF NOT EXISTS idx_todos_category ON todos(category)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : step.sql()) {
                    st.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum(step));
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
