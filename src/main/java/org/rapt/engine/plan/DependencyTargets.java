package org.rapt.engine.plan;

final class DependencyTargets {

    private DependencyTargets() {
    }

    static void requireRelationOrSelection(RaNode target) {
        boolean valid = target instanceof RelationNode
                || (target instanceof SelectNode select && select.child() instanceof RelationNode);
        if (!valid) {
            throw new InputException("A dependency applies to a relation or a selection of one, got "
                    + target.operator() + ".");
        }
    }
}
