package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Projection of a child onto a subset of its attributes, in the requested order.
 *
 * @param child      The projected node
 * @param attributes The kept attributes
 */
public record ProjectNode(RaNode child, AttributeList attributes) implements RaNode {

    public ProjectNode {
        Objects.requireNonNull(child, "Child cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
    }

    /**
     * @throws AttributeReferenceException if a reference does not resolve against the child
     */
    public static ProjectNode of(RaNode child, List<String> references) {
        return new ProjectNode(child, child.attributes().trim(references));
    }

    @Override
    public Operator operator() {
        return Operator.PROJECT;
    }

    @Override
    public String name() {
        return child.name();
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
