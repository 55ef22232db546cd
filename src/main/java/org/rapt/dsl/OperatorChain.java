package org.rapt.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Left-associative chain of binary operators of one precedence level:
 * {@code first op1 operand1 op2 operand2 ...} means {@code ((first op1 operand1) op2 operand2)}.
 */
public record OperatorChain(RaExpression first, List<ChainLink> links) implements RaExpression {

    public OperatorChain {
        Objects.requireNonNull(first, "First operand cannot be null");
        links = List.copyOf(links);
        if (links.isEmpty()) {
            throw new IllegalArgumentException("An operator chain needs at least one operator");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(first);
        for (ChainLink link : links) {
            sb.append(' ').append(link);
        }
        return sb.append(')').toString();
    }
}
