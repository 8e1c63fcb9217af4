package io.taskdesk.query;

import io.taskdesk.model.DueWindow;
import io.taskdesk.model.SortMode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles listing parameters into a {@link QueryPlan}.
 *
 * <p>Filters become a list of {@link Condition}s that are AND-composed. Due windows are
 * evaluated against the {@code today} passed in, never against the database clock, so a
 * listing is reproducible for a fixed date.
 */
public final class QueryCompiler {
    private static final String NEWEST_FIRST = "created_at DESC";
    private static final String TIE_BREAK = "id DESC";

    private final int pageSize;

    public QueryCompiler(int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.pageSize = pageSize;
    }

    public int pageSize() {
        return pageSize;
    }

    public QueryPlan compile(TaskQuery query, LocalDate today) {
        List<Condition> conditions = conditions(query, today);
        StringBuilder where = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (Condition condition : conditions) {
            if (where.length() > 0) {
                where.append(" AND ");
            }
            condition.appendSql(where, params);
        }
        return new QueryPlan(where.toString(), params, orderBy(query.sort()), query.page(), pageSize);
    }

    List<Condition> conditions(TaskQuery query, LocalDate today) {
        List<Condition> out = new ArrayList<>();
        if (query.filtersByCategory()) {
            out.add(Clause.eq(TaskColumn.CATEGORY, query.category()));
        }
        switch (query.status()) {
            case ACTIVE -> out.add(Clause.eq(TaskColumn.COMPLETED, 0));
            case COMPLETED -> out.add(Clause.eq(TaskColumn.COMPLETED, 1));
            default -> {
            }
        }
        if (query.filtersByPriority()) {
            out.add(Clause.eq(TaskColumn.PRIORITY, query.priority()));
        }
        addDueWindow(out, query.due(), today);
        if (!query.search().isEmpty()) {
            String pattern = LikePatterns.contains(query.search());
            out.add(new AnyOf(List.of(
                    new Clause(TaskColumn.TITLE, Operator.LIKE, pattern),
                    new Clause(TaskColumn.DESCRIPTION, Operator.LIKE, pattern)
            )));
        }
        return out;
    }

    private static void addDueWindow(List<Condition> out, DueWindow due, LocalDate today) {
        String day = today.toString();
        switch (due) {
            case OVERDUE -> {
                out.add(Clause.notNull(TaskColumn.DUE_DATE));
                out.add(new Clause(TaskColumn.DUE_DATE, Operator.LT, day));
            }
            case TODAY -> out.add(Clause.eq(TaskColumn.DUE_DATE, day));
            case WEEK -> {
                out.add(Clause.notNull(TaskColumn.DUE_DATE));
                out.add(new Clause(TaskColumn.DUE_DATE, Operator.GE, day));
                out.add(new Clause(TaskColumn.DUE_DATE, Operator.LE, today.plusDays(DueWindow.WEEK_DAYS).toString()));
            }
            default -> {
            }
        }
    }

    static String orderBy(SortMode sort) {
        String primary = switch (sort) {
            case DUE_DATE -> "due_date IS NULL, due_date ASC, " + NEWEST_FIRST;
            case CREATED_AT -> NEWEST_FIRST;
            case PRIORITY -> "CASE priority WHEN 'high' THEN 1 WHEN 'medium' THEN 2 WHEN 'low' THEN 3 ELSE 4 END, "
                    + NEWEST_FIRST;
            case ALPHA -> "title COLLATE NOCASE ASC";
            default -> "completed ASC, " + NEWEST_FIRST;
        };
        return primary + ", " + TIE_BREAK;
    }
}
