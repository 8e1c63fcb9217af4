package io.taskdesk.web;

import io.taskdesk.model.DueWindow;
import io.taskdesk.model.SortMode;
import io.taskdesk.model.StatusFilter;
import io.taskdesk.model.Task;
import io.taskdesk.query.TaskQuery;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server-side rendering of the task list and error pages.
 */
final class TaskListPage {
    private static final String LAYOUT_PATH = "/web/layout.html";
    private static final String LAYOUT = load(LAYOUT_PATH);
    private static final List<String> PRIORITIES = List.of("high", "medium", "low");
    private static final List<String> CATEGORIES = List.of("personal", "work", "shopping", "health", "other");

    private TaskListPage() {
    }

    static String render(ListingView view, LocalDate today) {
        StringBuilder body = new StringBuilder(8192);
        body.append("<h1>Tasks</h1>\n");
        appendAddForm(body);
        appendFilterForm(body, view);
        appendRows(body, view, today);
        appendPagination(body, view);
        return layout("Tasks", body.toString());
    }

    static String renderError(int status, String message) {
        String body = "<h1>Error " + status + "</h1>\n"
                + "<section class=\"error\"><p>" + Html.escape(message) + "</p></section>\n"
                + "<p><a href=\"/\">Back to tasks</a></p>\n";
        return layout("Error " + status, body);
    }

    private static void appendAddForm(StringBuilder out) {
        out.append("<section>\n<h2>Add task</h2>\n")
                .append("<form class=\"inline\" method=\"post\" action=\"/add\">\n")
                .append("<input name=\"title\" placeholder=\"Title\" required>\n")
                .append("<input name=\"description\" placeholder=\"Description\">\n");
        appendSelect(out, "priority", PRIORITIES, "medium", false);
        appendSelect(out, "category", CATEGORIES, "personal", false);
        out.append("<input type=\"date\" name=\"due_date\">\n")
                .append("<button type=\"submit\">Add</button>\n</form>\n</section>\n");
    }

    private static void appendFilterForm(StringBuilder out, ListingView view) {
        out.append("<section>\n<form class=\"inline\" method=\"get\" action=\"/\">\n")
                .append("<input name=\"q\" placeholder=\"Search\" value=\"")
                .append(Html.escape(view.searchQuery())).append("\">\n");
        appendSelect(out, "category", CATEGORIES, view.currentCategory(), true);
        appendSelect(out, "status", paramsOf(StatusFilter.values()), view.filterStatus(), false);
        appendSelect(out, "priority", PRIORITIES, view.filterPriority(), true);
        appendSelect(out, "due", paramsOf(DueWindow.values()), view.filterDue(), false);
        appendSelect(out, "sort", paramsOf(SortMode.values()), view.sortBy(), false);
        out.append("<button type=\"submit\">Apply</button>\n<a href=\"/\">Reset</a>\n</form>\n</section>\n");
    }

    private static void appendRows(StringBuilder out, ListingView view, LocalDate today) {
        out.append("<section>\n<p class=\"muted\">").append(view.totalCount()).append(" task(s)</p>\n");
        if (view.rows().isEmpty()) {
            out.append("<p class=\"muted\">No tasks found.</p>\n</section>\n");
            return;
        }
        out.append("<table>\n<thead><tr><th></th><th>Task</th><th>Priority</th><th>Category</th><th>Due</th><th></th></tr></thead>\n<tbody>\n");
        for (Task task : view.rows()) {
            out.append("<tr").append(task.completed() ? " class=\"completed\"" : "").append(">\n")
                    .append("<td><a href=\"/toggle/").append(task.id()).append("\">")
                    .append(task.completed() ? "&#9745;" : "&#9744;").append("</a></td>\n")
                    .append("<td><span class=\"title\">").append(Html.escape(task.title())).append("</span>");
            if (!task.description().isEmpty()) {
                out.append("<br><span class=\"muted\">").append(Html.escape(task.description())).append("</span>");
            }
            out.append("</td>\n")
                    .append("<td class=\"priority-").append(Html.escape(task.priority())).append("\">")
                    .append(Html.escape(task.priority())).append("</td>\n")
                    .append("<td>").append(Html.escape(task.category())).append("</td>\n")
                    .append("<td").append(task.isOverdue(today) ? " class=\"overdue\"" : "").append(">")
                    .append(task.dueDate() == null ? "" : task.dueDate().toString()).append("</td>\n")
                    .append("<td>");
            appendEditForm(out, task);
            out.append(" <a href=\"/delete/").append(task.id()).append("\">Delete</a></td>\n</tr>\n");
        }
        out.append("</tbody>\n</table>\n</section>\n");
    }

    private static void appendEditForm(StringBuilder out, Task task) {
        out.append("<details><summary>Edit</summary>\n")
                .append("<form method=\"post\" action=\"/edit/").append(task.id()).append("\">\n")
                .append("<input name=\"title\" required value=\"").append(Html.escape(task.title())).append("\">\n")
                .append("<input name=\"description\" value=\"").append(Html.escape(task.description())).append("\">\n");
        appendSelect(out, "priority", PRIORITIES, task.priority(), false);
        appendSelect(out, "category", CATEGORIES, task.category(), false);
        out.append("<input type=\"date\" name=\"due_date\" value=\"")
                .append(task.dueDate() == null ? "" : task.dueDate().toString()).append("\">\n")
                .append("<button type=\"submit\">Save</button>\n</form>\n</details>");
    }

    private static void appendPagination(StringBuilder out, ListingView view) {
        if (view.totalPages() <= 1 && view.page() <= 1) {
            return;
        }
        out.append("<nav class=\"pages\">\n");
        if (view.page() > 1) {
            out.append("<a href=\"/").append(pageLink(view, view.page() - 1)).append("\">Previous</a>\n");
        }
        out.append("<span>Page ").append(view.page()).append(" of ").append(view.totalPages()).append("</span>\n");
        if (view.page() < view.totalPages()) {
            out.append("<a href=\"/").append(pageLink(view, view.page() + 1)).append("\">Next</a>\n");
        }
        out.append("</nav>\n");
    }

    static String pageLink(ListingView view, int page) {
        Map<String, String> params = new LinkedHashMap<>(view.filterParams());
        params.put("page", String.valueOf(page));
        return Html.escape(Html.queryString(params));
    }

    private static void appendSelect(StringBuilder out, String name, List<String> options, String selected, boolean withAll) {
        out.append("<select name=\"").append(name).append("\">\n");
        boolean matched = false;
        if (withAll) {
            matched = TaskQuery.ALL.equals(selected);
            appendOption(out, "all", matched);
        }
        for (String option : options) {
            boolean isSelected = option.equalsIgnoreCase(selected);
            matched |= isSelected;
            appendOption(out, option, isSelected);
        }
        // Free-text values outside the suggested list stay selectable.
        if (!matched && selected != null && !selected.isBlank()) {
            appendOption(out, selected, true);
        }
        out.append("</select>\n");
    }

    private static void appendOption(StringBuilder out, String value, boolean selected) {
        String escaped = Html.escape(value);
        out.append("<option value=\"").append(escaped).append('"')
                .append(selected ? " selected" : "").append('>').append(escaped).append("</option>\n");
    }

    private static List<String> paramsOf(StatusFilter[] values) {
        return Arrays.stream(values).map(StatusFilter::param).toList();
    }

    private static List<String> paramsOf(DueWindow[] values) {
        return Arrays.stream(values).map(DueWindow::param).toList();
    }

    private static List<String> paramsOf(SortMode[] values) {
        return Arrays.stream(values).map(SortMode::param).toList();
    }

    private static String layout(String title, String body) {
        return LAYOUT.replace("{{title}}", Html.escape(title)).replace("{{body}}", body);
    }

    private static String load(String resourcePath) {
        try (InputStream in = TaskListPage.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Missing page resource: " + resourcePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load page resource: " + resourcePath, e);
        }
    }
}
