package org.rapt.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * Composable SELECT query. Translators refine a child's query block by block instead of nesting
 * a subquery for every operator.
 *
 * @param prefix   Text emitted before the query, e.g. {@code CREATE TEMPORARY TABLE t(a) AS }
 * @param select   The select list; empty for a bare relation reference
 * @param from     The FROM clause
 * @param where    The WHERE condition, or empty
 * @param distinct Whether to emit {@code SELECT DISTINCT}
 * @param columns  How each attribute of the translated node is referenced in this query's scope, by
 *                 position; empty when every attribute is referenced by its qualified name
 */
public record SqlQuery(String prefix, String select, String from, String where, boolean distinct,
                       List<String> columns) implements SqlStatement {

    public SqlQuery {
        Objects.requireNonNull(prefix, "Prefix cannot be null");
        Objects.requireNonNull(select, "Select cannot be null");
        Objects.requireNonNull(from, "From cannot be null");
        Objects.requireNonNull(where, "Where cannot be null");
        columns = List.copyOf(columns);
    }

    public static SqlQuery of(String select, String from, boolean distinct) {
        return new SqlQuery("", select, from, "", distinct, List.of());
    }

    public SqlQuery withSelect(String newSelect) {
        return new SqlQuery(prefix, newSelect, from, where, distinct, columns);
    }

    public SqlQuery withWhere(String newWhere) {
        return new SqlQuery(prefix, select, from, newWhere, distinct, columns);
    }

    public SqlQuery withPrefix(String newPrefix) {
        return new SqlQuery(newPrefix, select, from, where, distinct, columns);
    }

    public SqlQuery withColumns(List<String> newColumns) {
        return new SqlQuery(prefix, select, from, where, distinct, newColumns);
    }

    @Override
    public String toSql() {
        StringBuilder sql = new StringBuilder(prefix);
        if (select.isEmpty()) {
            sql.append(from);
        } else {
            sql.append("SELECT ");
            if (distinct) {
                sql.append("DISTINCT ");
            }
            sql.append(select).append(" FROM ").append(from);
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(where);
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSql();
    }
}
