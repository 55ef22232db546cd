package org.rapt.dsl;

import java.util.List;
import java.util.Objects;

/**
 * {@code \project_{a, b} operand}.
 */
public record ProjectExpression(List<String> attributes, RaExpression operand) implements RaExpression {

    public ProjectExpression {
        attributes = List.copyOf(attributes);
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public String toString() {
        return "(PROJECT[" + String.join(", ", attributes) + "] " + operand + ")";
    }
}
