package io.taskdesk.query;

public enum Operator {
    EQ,
    LT,
    GE,
    LE,
    IS_NOT_NULL,
    /** Substring match; the clause value is an already-escaped LIKE pattern. */
    LIKE
}
