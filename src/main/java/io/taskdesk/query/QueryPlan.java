package io.taskdesk.query;

import java.util.ArrayList;
import java.util.List;

/**
 * A compiled listing predicate with its ordering and page window.
 *
 * <p>The row query and the count query are both rendered from the same {@link #whereSql()} and
 * {@link #whereParams()}, so the count always matches the rows reachable across all pages.
 */
public record QueryPlan(
        String whereSql,
        List<Object> whereParams,
        String orderBySql,
        int page,
        int pageSize
) {
    public static final String TABLE = "todos";
    public static final String TASK_COLUMNS =
            "id,title,description,priority,category,completed,created_at,due_date,updated_at";

    public QueryPlan {
        whereParams = List.copyOf(whereParams);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public String rowSql() {
        return "SELECT " + TASK_COLUMNS + " FROM " + TABLE + whereClause()
                + " ORDER BY " + orderBySql + " LIMIT ? OFFSET ?";
    }

    public List<Object> rowParams() {
        List<Object> out = new ArrayList<>(whereParams);
        out.add(pageSize);
        out.add(offset());
        return out;
    }

    public String countSql() {
        return "SELECT COUNT(*) FROM " + TABLE + whereClause();
    }

    public List<Object> countParams() {
        return whereParams;
    }

    private String whereClause() {
        return whereSql.isEmpty() ? "" : " WHERE " + whereSql;
    }
}
