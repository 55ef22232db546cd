package org.rapt.engine.transpiler;

/**
 * A generated SQL statement.
 */
public sealed interface SqlStatement permits SqlQuery, AlterTableStatement {

    String toSql();
}
