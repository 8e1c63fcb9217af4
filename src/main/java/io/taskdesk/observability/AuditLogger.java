package io.taskdesk.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskdesk.util.Hashing;
import io.taskdesk.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL record of task mutations. Each row carries the hash of the previous row,
 * so truncation or in-place edits of the file are detectable.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("task_id", event.taskId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-hashes every row and checks the {@code prev_hash} links.
     */
    @SuppressWarnings("unchecked")
    public synchronized VerifyOutcome verify() {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            String expectedPrev = "";
            int checked = 0;
            for (String line : lines) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                checked++;
                JsonNode node = Jsons.mapper().readTree(line);
                String hash = node.path("hash").asText("");
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                    return new VerifyOutcome(false, checked, "prev_hash mismatch at row " + checked);
                }
                Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
                row.remove("hash");
                if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    return new VerifyOutcome(false, checked, "hash mismatch at row " + checked);
                }
                expectedPrev = hash;
            }
            return new VerifyOutcome(true, checked, "");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log {} has an unreadable tail, starting a new hash chain", auditFile, e);
            return "";
        }
    }

    public record AuditEvent(String action, Long taskId, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, Long taskId, String result, Map<String, Object> details) {
            return new AuditEvent(action, taskId, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean ok, int checkedRows, String error) {
    }
}
