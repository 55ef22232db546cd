package org.rapt.engine.plan;

/**
 * Binary condition operators: connectives and comparisons.
 */
public enum BinaryConditionOperator {
    AND("AND", "\\land"),
    OR("OR", "\\lor"),
    EQUAL("=", "\\eq"),
    NOT_EQUAL("<>", "\\neq"),
    LESS_THAN("<", "\\lt"),
    LESS_THAN_EQUAL("<=", "\\leq"),
    GREATER_THAN(">", "\\gt"),
    GREATER_THAN_EQUAL(">=", "\\geq");

    private final String sql;
    private final String latex;

    BinaryConditionOperator(String sql, String latex) {
        this.sql = sql;
        this.latex = latex;
    }

    public String toSql() {
        return sql;
    }

    public String toLatex() {
        return latex;
    }

    public boolean isComparison() {
        return this != AND && this != OR;
    }
}
