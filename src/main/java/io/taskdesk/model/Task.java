package io.taskdesk.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record Task(
        long id,
        String title,
        String description,
        String priority,
        String category,
        boolean completed,
        LocalDateTime createdAt,
        LocalDate dueDate,
        LocalDateTime updatedAt
) {
    public boolean isOverdue(LocalDate today) {
        return !completed && dueDate != null && dueDate.isBefore(today);
    }
}
