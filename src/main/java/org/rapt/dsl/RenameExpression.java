package org.rapt.dsl;

import java.util.List;
import java.util.Objects;

/**
 * {@code \rename_{name}}, {@code \rename_{(a, b)}} or {@code \rename_{name(a, b)}} applied to an operand.
 *
 * @param name       The new relation name, or null when only attributes are renamed
 * @param attributes The new attribute names, empty when only the relation is renamed
 * @param operand    The renamed expression
 */
public record RenameExpression(String name, List<String> attributes, RaExpression operand) implements RaExpression {

    public RenameExpression {
        attributes = List.copyOf(attributes);
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (name == null && attributes.isEmpty()) {
            throw new IllegalArgumentException("A rename needs a name or attributes");
        }
    }

    @Override
    public String toString() {
        String target = (name == null ? "" : name)
                + (attributes.isEmpty() ? "" : "(" + String.join(", ", attributes) + ")");
        return "(RENAME[" + target + "] " + operand + ")";
    }
}
