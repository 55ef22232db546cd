package org.rapt.dsl;

/**
 * Parse result of a relational algebra expression. Nesting mirrors operator precedence.
 */
public sealed interface RaExpression
        permits RelationReference, ProjectExpression, SelectExpression, RenameExpression, OperatorChain {
}
