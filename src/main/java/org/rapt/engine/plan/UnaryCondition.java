package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

public record UnaryCondition(UnaryConditionOperator operator, Condition operand) implements Condition {

    public UnaryCondition {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    public static UnaryCondition not(Condition operand) {
        return new UnaryCondition(UnaryConditionOperator.NOT, operand);
    }

    public static UnaryCondition defined(Condition operand) {
        return new UnaryCondition(UnaryConditionOperator.DEFINED, operand);
    }

    @Override
    public String toSql(UnaryOperator<String> references) {
        return operator.toSql(operand.toSql(references));
    }

    @Override
    public String toLatex() {
        return operator.toLatex(operand.toLatex());
    }

    @Override
    public List<String> attributeReferences() {
        return operand.attributeReferences();
    }

    @Override
    public String toString() {
        return toSql();
    }
}
