package org.rapt.dsl;

import java.util.List;
import java.util.Objects;

/**
 * {@code name := expr} or {@code name(a, b) := expr}.
 *
 * @param name       The assigned relation name
 * @param attributes New attribute names, empty to keep the expression's
 * @param expression The assigned expression
 */
public record AssignmentStatement(String name, List<String> attributes, RaExpression expression)
        implements Statement {

    public AssignmentStatement {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
        attributes = List.copyOf(attributes);
    }

    @Override
    public String toString() {
        String target = attributes.isEmpty() ? name : name + "(" + String.join(", ", attributes) + ")";
        return target + " := " + expression;
    }
}
