package org.rapt.engine.plan;

/**
 * Unary condition operators. {@code DEFINED} supports three-valued logic over nullable attributes.
 */
public enum UnaryConditionOperator {
    NOT("NOT %s", "\\neg %s"),
    DEFINED("%s IS NOT NULL", "\\text{defined}(%s)");

    private final String sqlTemplate;
    private final String latexTemplate;

    UnaryConditionOperator(String sqlTemplate, String latexTemplate) {
        this.sqlTemplate = sqlTemplate;
        this.latexTemplate = latexTemplate;
    }

    public String toSql(String operand) {
        return String.format(sqlTemplate, operand);
    }

    public String toLatex(String operand) {
        return String.format(latexTemplate, operand);
    }
}
