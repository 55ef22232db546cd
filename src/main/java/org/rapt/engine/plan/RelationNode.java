package org.rapt.engine.plan;

import org.rapt.engine.store.Schema;

import java.util.Locale;
import java.util.Objects;

/**
 * Reference to a relation registered in the schema.
 *
 * @param name       The relation name
 * @param attributes The relation's attributes, qualified by its name
 */
public record RelationNode(String name, AttributeList attributes) implements RaNode {

    public RelationNode {
        Objects.requireNonNull(name, "Relation name cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
    }

    /**
     * @throws RelationReferenceException if the relation is not in the schema
     */
    public static RelationNode of(String name, Schema schema) {
        String normalized = name.toLowerCase(Locale.ROOT);
        return new RelationNode(normalized, AttributeList.of(normalized, schema.getAttributes(normalized)));
    }

    @Override
    public Operator operator() {
        return Operator.RELATION;
    }

    @Override
    public <T> T accept(RaNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "RelationNode(" + name + ")";
    }
}
