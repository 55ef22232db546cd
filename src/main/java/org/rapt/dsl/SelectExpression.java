package org.rapt.dsl;

import org.rapt.engine.plan.Condition;

import java.util.Objects;

/**
 * {@code \select_{condition} operand}.
 */
public record SelectExpression(Condition condition, RaExpression operand) implements RaExpression {

    public SelectExpression {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public String toString() {
        return "(SELECT[" + condition.toSql() + "] " + operand + ")";
    }
}
