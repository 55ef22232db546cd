package org.rapt.engine.plan;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Predicate of a select, a conditional join, or a filtered dependency target.
 * Every binary application renders fully parenthesized in both targets.
 */
public sealed interface Condition permits IdentityCondition, UnaryCondition, BinaryCondition {

    default String toSql() {
        return toSql(UnaryOperator.identity());
    }

    /**
     * Renders SQL with every attribute reference replaced by {@code references}; literals are kept.
     */
    String toSql(UnaryOperator<String> references);

    String toLatex();

    /**
     * Texts of the leaves that are attribute references, in left-to-right order. Literals are excluded.
     */
    List<String> attributeReferences();
}
