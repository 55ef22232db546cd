package org.rapt.engine.transpiler;

import org.rapt.engine.plan.SetOperationNode;

/**
 * Transpiles node trees into SQL with set semantics: every SELECT is DISTINCT and set operations
 * drop ALL.
 */
public class SetSemanticsSQLGenerator extends SQLGenerator {

    @Override
    protected boolean isDistinct() {
        return true;
    }

    @Override
    protected String setOperatorSql(SetOperationNode.SetOperator operator) {
        return operator.toSql();
    }
}
