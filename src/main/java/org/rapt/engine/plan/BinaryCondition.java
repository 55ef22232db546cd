package org.rapt.engine.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

public record BinaryCondition(BinaryConditionOperator operator, Condition left, Condition right)
        implements Condition {

    public BinaryCondition {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryCondition and(Condition left, Condition right) {
        return new BinaryCondition(BinaryConditionOperator.AND, left, right);
    }

    public static BinaryCondition or(Condition left, Condition right) {
        return new BinaryCondition(BinaryConditionOperator.OR, left, right);
    }

    public static BinaryCondition compare(String left, BinaryConditionOperator operator, String right) {
        return new BinaryCondition(operator, new IdentityCondition(left), new IdentityCondition(right));
    }

    @Override
    public String toSql(UnaryOperator<String> references) {
        return "(" + left.toSql(references) + " " + operator.toSql() + " " + right.toSql(references) + ")";
    }

    @Override
    public String toLatex() {
        return "(" + left.toLatex() + " " + operator.toLatex() + " " + right.toLatex() + ")";
    }

    @Override
    public List<String> attributeReferences() {
        List<String> references = new ArrayList<>(left.attributeReferences());
        references.addAll(right.attributeReferences());
        return references;
    }

    @Override
    public String toString() {
        return toSql();
    }
}
