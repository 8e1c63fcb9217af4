package io.taskdesk.query;

import java.util.List;

/**
 * One AND-composed term of a listing predicate.
 */
public interface Condition {
    void appendSql(StringBuilder sql, List<Object> params);
}
