package org.rapt.dsl;

import java.util.List;
import java.util.Objects;

/**
 * {@code name(a, b)}: declares a relation.
 */
public record DefinitionStatement(String name, List<String> attributes) implements Statement {

    public DefinitionStatement {
        Objects.requireNonNull(name, "Name cannot be null");
        attributes = List.copyOf(attributes);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", attributes) + ")";
    }
}
