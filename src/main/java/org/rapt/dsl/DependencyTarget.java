package org.rapt.dsl;

import org.rapt.engine.plan.Condition;

import java.util.Objects;

/**
 * The relation a dependency applies to, optionally filtered by a selection.
 *
 * @param relation  The relation name
 * @param condition The selection condition, or null
 */
public record DependencyTarget(String relation, Condition condition) {

    public DependencyTarget {
        Objects.requireNonNull(relation, "Relation cannot be null");
    }

    public boolean isSelection() {
        return condition != null;
    }

    @Override
    public String toString() {
        return condition == null ? relation : "(SELECT[" + condition.toSql() + "] " + relation + ")";
    }
}
