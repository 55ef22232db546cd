package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Union, difference or intersection of two nodes with identical attribute names.
 * The result's attributes are unqualified.
 */
public record SetOperationNode(SetOperator setOperator, RaNode left, RaNode right, AttributeList attributes)
        implements RaNode {

    public SetOperationNode {
        Objects.requireNonNull(setOperator, "Set operator cannot be null");
        Objects.requireNonNull(left, "Left input cannot be null");
        Objects.requireNonNull(right, "Right input cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
    }

    /**
     * @throws InputException if the two sides' attribute names differ
     */
    public static SetOperationNode of(SetOperator setOperator, RaNode left, RaNode right) {
        List<String> names = left.attributes().names();
        if (!names.equals(right.attributes().names())) {
            throw new InputException("Set operations require identical relation schemas: ("
                    + String.join(", ", names) + ") vs (" + String.join(", ", right.attributes().names()) + ").");
        }
        return new SetOperationNode(setOperator, left, right, AttributeList.unqualified(names));
    }

    @Override
    public Operator operator() {
        return setOperator.operator();
    }

    @Override
    public String name() {
        return null;
    }

    @Override
    public List<RaNode> children() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(RaNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    public enum SetOperator {
        UNION(Operator.UNION, "UNION"),
        DIFFERENCE(Operator.DIFFERENCE, "EXCEPT"),
        INTERSECT(Operator.INTERSECT, "INTERSECT");

        private final Operator operator;
        private final String sql;

        SetOperator(Operator operator, String sql) {
            this.operator = operator;
            this.sql = sql;
        }

        public Operator operator() {
            return operator;
        }

        public String toSql() {
            return sql;
        }
    }
}
