package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Functional dependency {@code fd_{a, b} R;}: a determines b, optionally within a selection of R.
 *
 * @param target         A {@link RelationNode} or a {@link SelectNode} over one
 * @param attributeNames Exactly two attribute names
 */
public record FunctionalDependencyNode(RaNode target, List<String> attributeNames) implements RaNode {

    public FunctionalDependencyNode {
        Objects.requireNonNull(target, "Target cannot be null");
        attributeNames = List.copyOf(attributeNames);
        DependencyTargets.requireRelationOrSelection(target);
        if (attributeNames.size() != 2) {
            throw new InputException("A dependency relates exactly two attributes, got " + attributeNames + ".");
        }
    }

    public String relationName() {
        return target.name();
    }

    @Override
    public Operator operator() {
        return Operator.FUNCTIONAL_DEPENDENCY;
    }

    @Override
    public String name() {
        return null;
    }

    @Override
    public AttributeList attributes() {
        return AttributeList.of(relationName(), attributeNames);
    }

    @Override
    public List<RaNode> children() {
        return List.of(target);
    }

    @Override
    public <T> T accept(RaNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
