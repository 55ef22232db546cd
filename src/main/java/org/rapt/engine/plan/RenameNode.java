package org.rapt.engine.plan;

import org.rapt.engine.store.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Renaming of a child's relation, attributes, or both. Unlike {@link AssignNode} it does not register
 * anything in the schema.
 *
 * @param child      The renamed node
 * @param name       The resulting relation name, the child's when only attributes are renamed
 * @param attributes The renamed attributes
 */
public record RenameNode(RaNode child, String name, AttributeList attributes) implements RaNode {

    public RenameNode {
        Objects.requireNonNull(child, "Child cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
    }

    /**
     * @param newName       The new relation name, or null to keep the child's
     * @param newAttributes New attribute names, or empty to keep the child's
     * @throws RelationReferenceException if {@code newName} is already in the schema
     * @throws InputException             if the number of attribute names does not match
     */
    public static RenameNode of(RaNode child, String newName, List<String> newAttributes, Schema schema) {
        if (newName != null && schema.contains(newName)) {
            throw new RelationReferenceException("Cannot rename to '" + newName + "': the relation already exists.");
        }
        String name = newName != null ? newName : child.name();
        return new RenameNode(child, name, child.attributes().rename(newAttributes, name));
    }

    @Override
    public Operator operator() {
        return Operator.RENAME;
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
