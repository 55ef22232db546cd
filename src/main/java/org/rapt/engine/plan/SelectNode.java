package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Restriction of a child by a condition. Exposes the child's name and attributes.
 *
 * @throws AttributeReferenceException if the condition references an attribute the child lacks
 */
public record SelectNode(RaNode child, Condition condition) implements RaNode {

    public SelectNode {
        Objects.requireNonNull(child, "Child cannot be null");
        Objects.requireNonNull(condition, "Condition cannot be null");
        child.attributes().validate(condition.attributeReferences());
    }

    @Override
    public Operator operator() {
        return Operator.SELECT;
    }

    @Override
    public String name() {
        return child.name();
    }

    @Override
    public AttributeList attributes() {
        return child.attributes();
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
