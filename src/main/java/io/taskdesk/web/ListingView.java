package io.taskdesk.web;

import io.taskdesk.model.Task;
import io.taskdesk.model.TaskPage;
import io.taskdesk.query.TaskQuery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the listing page renders: one page of rows plus the active filter state.
 */
public record ListingView(
        List<Task> rows,
        long totalCount,
        String currentCategory,
        String searchQuery,
        int page,
        int totalPages,
        String filterStatus,
        String filterPriority,
        String filterDue,
        String sortBy
) {
    public static ListingView of(TaskQuery query, TaskPage result) {
        return new ListingView(
                result.rows(),
                result.totalCount(),
                query.category(),
                query.search(),
                query.page(),
                result.totalPages(),
                query.status().param(),
                query.priority(),
                query.due().param(),
                query.sort().param()
        );
    }

    /**
     * Listing parameters that reproduce this view on another page, without defaults.
     */
    Map<String, String> filterParams() {
        Map<String, String> out = new LinkedHashMap<>();
        putUnlessDefault(out, "category", currentCategory, TaskQuery.ALL);
        putUnlessDefault(out, "q", searchQuery, "");
        putUnlessDefault(out, "status", filterStatus, "all");
        putUnlessDefault(out, "priority", filterPriority, TaskQuery.ALL);
        putUnlessDefault(out, "due", filterDue, "all");
        putUnlessDefault(out, "sort", sortBy, "default");
        return out;
    }

    private static void putUnlessDefault(Map<String, String> out, String key, String value, String defaultValue) {
        if (value != null && !value.isEmpty() && !value.equals(defaultValue)) {
            out.put(key, value);
        }
    }
}
