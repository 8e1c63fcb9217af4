package io.taskdesk.query;

import io.taskdesk.model.DueWindow;
import io.taskdesk.model.SortMode;
import io.taskdesk.model.StatusFilter;

import java.util.Map;

/**
 * Request-scoped listing parameters. {@code "all"} disables the category and priority filters.
 */
public record TaskQuery(
        String category,
        StatusFilter status,
        String priority,
        DueWindow due,
        String search,
        SortMode sort,
        int page
) {
    public static final String ALL = "all";

    public TaskQuery {
        category = category == null || category.isBlank() ? ALL : category.trim();
        status = status == null ? StatusFilter.ALL : status;
        priority = priority == null || priority.isBlank() ? ALL : priority.trim();
        due = due == null ? DueWindow.ALL : due;
        search = search == null ? "" : search.trim();
        sort = sort == null ? SortMode.DEFAULT : sort;
        page = Math.max(1, page);
    }

    public static TaskQuery defaults() {
        return new TaskQuery(ALL, StatusFilter.ALL, ALL, DueWindow.ALL, "", SortMode.DEFAULT, 1);
    }

    /**
     * Reads the listing parameters used by the index page: category, status, priority, due, q, sort, page.
     */
    public static TaskQuery fromParams(Map<String, String> params) {
        return new TaskQuery(
                params.get("category"),
                StatusFilter.fromString(params.get("status")),
                params.get("priority"),
                DueWindow.fromString(params.get("due")),
                params.get("q"),
                SortMode.fromString(params.get("sort")),
                parsePage(params.get("page"))
        );
    }

    public TaskQuery withPage(int newPage) {
        return new TaskQuery(category, status, priority, due, search, sort, newPage);
    }

    public boolean filtersByCategory() {
        return !ALL.equals(category);
    }

    public boolean filtersByPriority() {
        return !ALL.equals(priority);
    }

    static int parsePage(String raw) {
        if (raw == null || raw.isBlank()) {
            return 1;
        }
        String trimmed = raw.trim();
        try {
            return Math.max(1, Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            // Digits past int range still name a page beyond the last one.
            return isDigits(trimmed) ? Integer.MAX_VALUE : 1;
        }
    }

    private static boolean isDigits(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }
}
