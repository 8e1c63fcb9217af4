package io.taskdesk.query;

import java.util.List;
import java.util.Objects;

public record Clause(TaskColumn column, Operator operator, Object value) implements Condition {
    public Clause {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        if (operator != Operator.IS_NOT_NULL && value == null) {
            throw new IllegalArgumentException("Operator " + operator + " requires a value");
        }
    }

    public static Clause eq(TaskColumn column, Object value) {
        return new Clause(column, Operator.EQ, value);
    }

    public static Clause notNull(TaskColumn column) {
        return new Clause(column, Operator.IS_NOT_NULL, null);
    }

    @Override
    public void appendSql(StringBuilder sql, List<Object> params) {
        String name = column.sqlName();
        switch (operator) {
            case EQ -> sql.append(name).append(" = ?");
            case LT -> sql.append(name).append(" < ?");
            case GE -> sql.append(name).append(" >= ?");
            case LE -> sql.append(name).append(" <= ?");
            case IS_NOT_NULL -> sql.append(name).append(" IS NOT NULL");
            case LIKE -> sql.append(name).append(" LIKE ? ESCAPE '").append(LikePatterns.ESCAPE_CHAR).append('\'');
            default -> throw new IllegalStateException("Unhandled operator: " + operator);
        }
        if (operator != Operator.IS_NOT_NULL) {
            params.add(value);
        }
    }
}
