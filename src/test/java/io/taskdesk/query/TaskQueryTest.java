package io.taskdesk.query;

import io.taskdesk.model.DueWindow;
import io.taskdesk.model.SortMode;
import io.taskdesk.model.StatusFilter;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskQueryTest {
    @Test
    void missingParamsFallBackToDefaults() {
        TaskQuery query = TaskQuery.fromParams(Map.of());
        assertEquals(TaskQuery.defaults(), query);
        assertFalse(query.filtersByCategory());
        assertFalse(query.filtersByPriority());
    }

    @Test
    void readsEveryListingParameter() {
        TaskQuery query = TaskQuery.fromParams(Map.of(
                "category", "work",
                "status", "completed",
                "priority", "high",
                "due", "overdue",
                "q", "  pay  ",
                "sort", "alpha",
                "page", "4"
        ));
        assertEquals("work", query.category());
        assertEquals(StatusFilter.COMPLETED, query.status());
        assertEquals("high", query.priority());
        assertEquals(DueWindow.OVERDUE, query.due());
        assertEquals("pay", query.search());
        assertEquals(SortMode.ALPHA, query.sort());
        assertEquals(4, query.page());
        assertTrue(query.filtersByCategory());
        assertTrue(query.filtersByPriority());
    }

    @Test
    void pageIsClampedToOne() {
        assertEquals(1, TaskQuery.fromParams(Map.of("page", "0")).page());
        assertEquals(1, TaskQuery.fromParams(Map.of("page", "-7")).page());
        assertEquals(1, TaskQuery.fromParams(Map.of("page", "two")).page());
        assertEquals(1, TaskQuery.defaults().withPage(-3).page());
    }

    @Test
    void pageBeyondIntRangeIsClampedToLargest() {
        assertEquals(Integer.MAX_VALUE, TaskQuery.fromParams(Map.of("page", "3000000000")).page());
        assertEquals(1, TaskQuery.fromParams(Map.of("page", "-3000000000")).page());
    }

    @Test
    void onlyLowercaseAllDisablesFilters() {
        TaskQuery query = TaskQuery.fromParams(Map.of("category", "All", "priority", "ALL"));
        assertTrue(query.filtersByCategory());
        assertTrue(query.filtersByPriority());
        assertEquals("All", query.category());
    }

    @Test
    void unknownEnumsFallBackToAll() {
        TaskQuery query = TaskQuery.fromParams(Map.of("status", "in_progress", "due", "tomorrow", "sort", "random"));
        assertEquals(StatusFilter.ALL, query.status());
        assertEquals(DueWindow.ALL, query.due());
        assertEquals(SortMode.DEFAULT, query.sort());
    }
}
