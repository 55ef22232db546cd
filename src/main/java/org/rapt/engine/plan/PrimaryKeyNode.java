package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Primary key constraint, {@code pk_{a, b} R;}.
 */
public record PrimaryKeyNode(RelationNode relation, List<String> attributeNames) implements RaNode {

    public PrimaryKeyNode {
        Objects.requireNonNull(relation, "Relation cannot be null");
        attributeNames = List.copyOf(attributeNames);
        if (attributeNames.isEmpty()) {
            throw new InputException("A primary key needs at least one attribute.");
        }
    }

    public String relationName() {
        return relation.name();
    }

    @Override
    public Operator operator() {
        return Operator.PRIMARY_KEY;
    }

    @Override
    public String name() {
        return null;
    }

    @Override
    public AttributeList attributes() {
        return AttributeList.of(relation.name(), attributeNames);
    }

    @Override
    public List<RaNode> children() {
        return List.of(relation);
    }

    @Override
    public <T> T accept(RaNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
