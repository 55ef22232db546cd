package org.rapt.engine.plan;

/**
 * Tag of every node kind.
 */
public enum Operator {
    RELATION,
    DEFINITION,
    SELECT,
    PROJECT,
    RENAME,
    ASSIGN,
    CROSS_JOIN,
    NATURAL_JOIN,
    THETA_JOIN,
    FULL_OUTER_JOIN,
    LEFT_OUTER_JOIN,
    RIGHT_OUTER_JOIN,
    UNION,
    DIFFERENCE,
    INTERSECT,
    PRIMARY_KEY,
    MULTIVALUED_DEPENDENCY,
    FUNCTIONAL_DEPENDENCY,
    INCLUSION_EQUIVALENCE,
    INCLUSION_SUBSUMPTION
}
