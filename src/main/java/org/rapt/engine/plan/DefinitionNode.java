package org.rapt.engine.plan;

import org.rapt.engine.store.Schema;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Declaration of a new relation, {@code R(a, b);}.
 */
public record DefinitionNode(String name, AttributeList attributes) implements RaNode {

    public DefinitionNode {
        Objects.requireNonNull(name, "Relation name cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
    }

    /**
     * Registers the relation in the schema.
     *
     * @throws RelationReferenceException if the name is already registered
     */
    public static DefinitionNode define(String name, List<String> attributes, Schema schema) {
        if (attributes.isEmpty()) {
            throw new InputException("Relation '" + name + "' must define at least one attribute.");
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        schema.add(normalized, attributes);
        return new DefinitionNode(normalized, AttributeList.of(normalized, schema.getAttributes(normalized)));
    }

    @Override
    public Operator operator() {
        return Operator.DEFINITION;
    }

    @Override
    public <T> T accept(RaNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
