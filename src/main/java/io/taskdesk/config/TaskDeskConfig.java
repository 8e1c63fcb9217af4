package io.taskdesk.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TaskDeskConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 5000;
    public static final int DEFAULT_HTTP_THREADS = 4;
    public static final int PAGE_SIZE = 50;
    public static final String DEFAULT_PRIORITY = "medium";
    public static final String DEFAULT_CATEGORY = "personal";

    private final Path rootDir;

    public TaskDeskConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TaskDeskConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root.trim());
        return new TaskDeskConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("taskdesk.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
