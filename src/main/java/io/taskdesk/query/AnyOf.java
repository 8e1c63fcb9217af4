package io.taskdesk.query;

import java.util.List;

/**
 * Disjunction of clauses, rendered as one parenthesized term.
 */
public record AnyOf(List<Clause> clauses) implements Condition {
    public AnyOf {
        if (clauses == null || clauses.isEmpty()) {
            throw new IllegalArgumentException("AnyOf requires at least one clause");
        }
        clauses = List.copyOf(clauses);
    }

    @Override
    public void appendSql(StringBuilder sql, List<Object> params) {
        sql.append('(');
        for (int i = 0; i < clauses.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            clauses.get(i).appendSql(sql, params);
        }
        sql.append(')');
    }
}
