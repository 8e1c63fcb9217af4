package io.taskdesk.model;

import java.util.List;

public record TaskPage(List<Task> rows, long totalCount, int page, int pageSize) {
    public TaskPage {
        rows = List.copyOf(rows);
    }

    public int totalPages() {
        if (totalCount <= 0 || pageSize <= 0) {
            return 0;
        }
        return (int) ((totalCount + pageSize - 1) / pageSize);
    }
}
