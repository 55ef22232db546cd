package org.rapt.dsl;

import java.util.Objects;

public record ExpressionStatement(RaExpression expression) implements Statement {

    public ExpressionStatement {
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
