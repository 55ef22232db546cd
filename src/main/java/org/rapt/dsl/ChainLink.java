package org.rapt.dsl;

import org.rapt.engine.plan.Condition;

import java.util.Objects;

/**
 * One {@code operator [params] operand} step of an {@link OperatorChain}.
 *
 * @param operator  The binary operator; {@code \join_{...}} is normalized to THETA_JOIN
 * @param condition The parameter condition, or null
 * @param operand   The right-hand operand
 */
public record ChainLink(SyntaxToken operator, Condition condition, RaExpression operand) {

    public ChainLink {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public String toString() {
        return operator + (condition == null ? "" : "[" + condition.toSql() + "]") + " " + operand;
    }
}
