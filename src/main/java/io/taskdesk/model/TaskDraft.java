package io.taskdesk.model;

import io.taskdesk.config.TaskDeskConfig;
import io.taskdesk.error.ValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Caller-supplied fields of a task, used for both create and full update.
 */
public record TaskDraft(
        String title,
        String description,
        String priority,
        String category,
        LocalDate dueDate
) {
    public static TaskDraft of(String title, String description, String priority, String category, String dueDate) {
        return new TaskDraft(title, description, priority, category, parseDueDate(dueDate));
    }

    /**
     * Applies field defaults and rejects a missing title.
     */
    public TaskDraft normalized() {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "Title is required");
        }
        return new TaskDraft(
                title,
                description == null ? "" : description,
                priority == null || priority.isBlank() ? TaskDeskConfig.DEFAULT_PRIORITY : priority.trim(),
                category == null || category.isBlank() ? TaskDeskConfig.DEFAULT_CATEGORY : category.trim(),
                dueDate
        );
    }

    public static LocalDate parseDueDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("due_date", "Due date must be formatted as YYYY-MM-DD: " + raw.trim());
        }
    }
}
