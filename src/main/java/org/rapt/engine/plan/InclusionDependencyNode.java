package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Inclusion dependency between two relations, {@code inc=_{a, b} (R, S);} or {@code inc⊆_{a, b} (R, S);}.
 * The first attribute belongs to the left relation, the second to the right one.
 */
public record InclusionDependencyNode(
        InclusionType inclusionType,
        RaNode left,
        RaNode right,
        List<String> attributeNames
) implements RaNode {

    public InclusionDependencyNode {
        Objects.requireNonNull(inclusionType, "Inclusion type cannot be null");
        Objects.requireNonNull(left, "Left target cannot be null");
        Objects.requireNonNull(right, "Right target cannot be null");
        attributeNames = List.copyOf(attributeNames);
        DependencyTargets.requireRelationOrSelection(left);
        DependencyTargets.requireRelationOrSelection(right);
        if (attributeNames.size() != 2) {
            throw new InputException("An inclusion dependency relates exactly two attributes, got "
                    + attributeNames + ".");
        }
    }

    public List<String> relationNames() {
        return List.of(left.name(), right.name());
    }

    @Override
    public Operator operator() {
        return inclusionType.operator();
    }

    @Override
    public String name() {
        return null;
    }

    @Override
    public AttributeList attributes() {
        return AttributeList.of(List.of(
                new Attribute(left.name(), attributeNames.get(0)),
                new Attribute(right.name(), attributeNames.get(1))));
    }

    @Override
    public List<RaNode> children() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(RaNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    public enum InclusionType {
        EQUIVALENCE(Operator.INCLUSION_EQUIVALENCE),
        SUBSUMPTION(Operator.INCLUSION_SUBSUMPTION);

        private final Operator operator;

        InclusionType(Operator operator) {
            this.operator = operator;
        }

        public Operator operator() {
            return operator;
        }
    }
}
