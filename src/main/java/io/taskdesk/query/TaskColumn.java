package io.taskdesk.query;

/**
 * Columns of the {@code todos} table that listing predicates may reference.
 */
public enum TaskColumn {
    TITLE("title"),
    DESCRIPTION("description"),
    PRIORITY("priority"),
    CATEGORY("category"),
    COMPLETED("completed"),
    DUE_DATE("due_date");

    private final String sqlName;

    TaskColumn(String sqlName) {
        this.sqlName = sqlName;
    }

    public String sqlName() {
        return sqlName;
    }
}
