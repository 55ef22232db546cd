package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a join of two nodes.
 *
 * Cross and natural joins carry no condition; theta and outer joins require one.
 *
 * @param joinType   The kind of join
 * @param left       The left input
 * @param right      The right input
 * @param condition  The join condition, or null for cross and natural joins
 * @param attributes Both sides' attributes, deduplicated by name for natural joins
 */
public record JoinNode(
        JoinType joinType,
        RaNode left,
        RaNode right,
        Condition condition,
        AttributeList attributes
) implements RaNode {

    public JoinNode {
        Objects.requireNonNull(joinType, "Join type cannot be null");
        Objects.requireNonNull(left, "Left input cannot be null");
        Objects.requireNonNull(right, "Right input cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
        if (joinType.isConditional() && condition == null) {
            throw new IllegalArgumentException(joinType + " requires a condition");
        }
        if (!joinType.isConditional() && condition != null) {
            throw new IllegalArgumentException(joinType + " does not take a condition");
        }
    }

    /**
     * Creates a CROSS JOIN.
     */
    public static JoinNode cross(RaNode left, RaNode right) {
        return of(JoinType.CROSS, left, right, null);
    }

    /**
     * Creates a NATURAL JOIN.
     */
    public static JoinNode natural(RaNode left, RaNode right) {
        return of(JoinType.NATURAL, left, right, null);
    }

    /**
     * Creates a theta join.
     */
    public static JoinNode theta(RaNode left, RaNode right, Condition condition) {
        return of(JoinType.THETA, left, right, condition);
    }

    /**
     * @throws RelationReferenceException  if both sides expose the same relation name
     * @throws AttributeReferenceException if the condition does not resolve against both sides
     */
    public static JoinNode of(JoinType joinType, RaNode left, RaNode right, Condition condition) {
        String leftName = left.name();
        if (leftName != null && !leftName.isEmpty() && leftName.equals(right.name())) {
            throw new RelationReferenceException("Ambiguous relation reference '" + leftName + "'.");
        }
        AttributeList merged = AttributeList.merge(left.attributes(), right.attributes());
        if (joinType.isConditional()) {
            Objects.requireNonNull(condition, "Join condition cannot be null");
            merged.validate(condition.attributeReferences());
        }
        if (joinType == JoinType.NATURAL) {
            merged = AttributeList.merge(left.attributes(), right.attributes().without(left.attributes().names()));
        }
        return new JoinNode(joinType, left, right, condition, merged);
    }

    @Override
    public Operator operator() {
        return joinType.operator();
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

    /**
     * Types of joins.
     */
    public enum JoinType {
        CROSS(Operator.CROSS_JOIN, "CROSS JOIN", false),
        NATURAL(Operator.NATURAL_JOIN, "NATURAL JOIN", false),
        THETA(Operator.THETA_JOIN, "JOIN", true),
        FULL_OUTER(Operator.FULL_OUTER_JOIN, "FULL OUTER JOIN", true),
        LEFT_OUTER(Operator.LEFT_OUTER_JOIN, "LEFT OUTER JOIN", true),
        RIGHT_OUTER(Operator.RIGHT_OUTER_JOIN, "RIGHT OUTER JOIN", true);

        private final Operator operator;
        private final String sql;
        private final boolean conditional;

        JoinType(Operator operator, String sql, boolean conditional) {
            this.operator = operator;
            this.sql = sql;
            this.conditional = conditional;
        }

        public Operator operator() {
            return operator;
        }

        public String toSql() {
            return sql;
        }

        public boolean isConditional() {
            return conditional;
        }
    }
}
