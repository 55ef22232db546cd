package org.rapt.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * {@code ALTER TABLE r ADD PRIMARY KEY (a, b)}.
 */
public record AlterTableStatement(String relation, List<String> primaryKey) implements SqlStatement {

    public AlterTableStatement {
        Objects.requireNonNull(relation, "Relation cannot be null");
        primaryKey = List.copyOf(primaryKey);
    }

    @Override
    public String toSql() {
        return "ALTER TABLE " + relation + " ADD PRIMARY KEY (" + String.join(", ", primaryKey) + ")";
    }

    @Override
    public String toString() {
        return toSql();
    }
}
