package org.rapt.engine.plan;

import org.rapt.engine.store.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Assignment of a child's result to a new relation name, {@code name(a, b) := expr}.
 */
public record AssignNode(RaNode child, String name, AttributeList attributes) implements RaNode {

    public AssignNode {
        Objects.requireNonNull(child, "Child cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
    }

    /**
     * Registers {@code name} in the schema.
     *
     * @throws InputException             if the name is empty or the attribute count does not match
     * @throws RelationReferenceException if the name is already registered
     */
    public static AssignNode of(RaNode child, String name, List<String> newAttributes, Schema schema) {
        if (name == null || name.isBlank()) {
            throw new InputException("Assignment requires a relation name.");
        }
        if (!newAttributes.isEmpty() && newAttributes.size() != child.attributes().size()) {
            throw new InputException("Assignment to '" + name + "' names " + newAttributes.size()
                    + " attributes but the expression has " + child.attributes().size() + ".");
        }
        AttributeList attributes = child.attributes().rename(newAttributes, name);
        schema.add(name, attributes.names());
        return new AssignNode(child, name, attributes);
    }

    @Override
    public Operator operator() {
        return Operator.ASSIGN;
    }

    @Override
    public List<RaNode> children() {
        return List.of(child);
    }

    @Override
    public <T> T accept(RaNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
