package io.taskdesk.web;

import io.taskdesk.model.DueWindow;
import io.taskdesk.model.SortMode;
import io.taskdesk.model.StatusFilter;
import io.taskdesk.model.Task;
import io.taskdesk.model.TaskPage;
import io.taskdesk.query.TaskQuery;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

final class TaskListPageTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 1, 5);

    @Test
    void pageLinksKeepActiveFilters() {
        TaskQuery query = new TaskQuery("work", StatusFilter.ACTIVE, TaskQuery.ALL, DueWindow.ALL, "a&b", SortMode.PRIORITY, 2);
        ListingView view = ListingView.of(query, new TaskPage(List.of(), 120, 2, 50));

        Assertions.assertEquals("?category=work&amp;q=a%26b&amp;status=active&amp;sort=priority&amp;page=3",
                TaskListPage.pageLink(view, 3));

        String html = TaskListPage.render(view, TODAY);
        Assertions.assertTrue(html.contains("Page 2 of 3"));
        Assertions.assertTrue(html.contains(">Previous</a>"));
        Assertions.assertTrue(html.contains(">Next</a>"));
    }

    @Test
    void overdueRowsAreMarked() {
        Task late = new Task(1, "Pay rent", "", "high", "home", false,
                LocalDateTime.of(2024, 1, 1, 9, 0), LocalDate.of(2024, 1, 4), LocalDateTime.of(2024, 1, 1, 9, 0));
        Task done = new Task(2, "Old chore", "", "low", "home", true,
                LocalDateTime.of(2024, 1, 1, 9, 0), LocalDate.of(2024, 1, 2), LocalDateTime.of(2024, 1, 3, 9, 0));
        ListingView view = ListingView.of(TaskQuery.defaults(), new TaskPage(List.of(late, done), 2, 1, 50));

        String html = TaskListPage.render(view, TODAY);
        Assertions.assertTrue(html.contains("<td class=\"overdue\">2024-01-04</td>"));
        Assertions.assertTrue(html.contains("<td>2024-01-02</td>"));
        Assertions.assertTrue(html.contains("href=\"/toggle/1\""));
        Assertions.assertTrue(html.contains("action=\"/edit/2\""));
        Assertions.assertFalse(html.contains("class=\"pages\""));
    }

    @Test
    void emptyListingSaysSo() {
        ListingView view = ListingView.of(TaskQuery.defaults(), new TaskPage(List.of(), 0, 1, 50));
        Assertions.assertTrue(TaskListPage.render(view, TODAY).contains("No tasks found."));
    }

    @Test
    void errorPageEscapesMessage() {
        String html = TaskListPage.renderError(400, "bad <input>");
        Assertions.assertTrue(html.contains("Error 400"));
        Assertions.assertTrue(html.contains("bad &lt;input&gt;"));
    }
}
