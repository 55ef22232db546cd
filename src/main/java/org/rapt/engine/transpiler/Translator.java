package org.rapt.engine.transpiler;

import org.rapt.engine.plan.AssignNode;
import org.rapt.engine.plan.DefinitionNode;
import org.rapt.engine.plan.FunctionalDependencyNode;
import org.rapt.engine.plan.InclusionDependencyNode;
import org.rapt.engine.plan.JoinNode;
import org.rapt.engine.plan.MultivaluedDependencyNode;
import org.rapt.engine.plan.PrimaryKeyNode;
import org.rapt.engine.plan.ProjectNode;
import org.rapt.engine.plan.RaNode;
import org.rapt.engine.plan.RaNodeVisitor;
import org.rapt.engine.plan.RelationNode;
import org.rapt.engine.plan.RenameNode;
import org.rapt.engine.plan.SelectNode;
import org.rapt.engine.plan.SetOperationNode;

/**
 * Base of all translators: one method per operator. The join, set and inclusion families are dispatched
 * on their enum type with exhaustive switches.
 *
 * @param <T> The translation result
 */
public abstract class Translator<T> implements RaNodeVisitor<T> {

    public T translate(RaNode node) {
        return node.accept(this);
    }

    protected abstract T relation(RelationNode node);

    protected abstract T definition(DefinitionNode node);

    protected abstract T select(SelectNode node);

    protected abstract T project(ProjectNode node);

    protected abstract T rename(RenameNode node);

    protected abstract T assign(AssignNode node);

    protected abstract T crossJoin(JoinNode node);

    protected abstract T naturalJoin(JoinNode node);

    protected abstract T thetaJoin(JoinNode node);

    protected abstract T fullOuterJoin(JoinNode node);

    protected abstract T leftOuterJoin(JoinNode node);

    protected abstract T rightOuterJoin(JoinNode node);

    protected abstract T union(SetOperationNode node);

    protected abstract T difference(SetOperationNode node);

    protected abstract T intersect(SetOperationNode node);

    protected abstract T primaryKey(PrimaryKeyNode node);

    protected abstract T multivaluedDependency(MultivaluedDependencyNode node);

    protected abstract T functionalDependency(FunctionalDependencyNode node);

    protected abstract T inclusionEquivalence(InclusionDependencyNode node);

    protected abstract T inclusionSubsumption(InclusionDependencyNode node);

    // ==================== Dispatch ====================

    @Override
    public final T visit(RelationNode relation) {
        return relation(relation);
    }

    @Override
    public final T visit(DefinitionNode definition) {
        return definition(definition);
    }

    @Override
    public final T visit(SelectNode select) {
        return select(select);
    }

    @Override
    public final T visit(ProjectNode project) {
        return project(project);
    }

    @Override
    public final T visit(RenameNode rename) {
        return rename(rename);
    }

    @Override
    public final T visit(AssignNode assign) {
        return assign(assign);
    }

    @Override
    public final T visit(JoinNode join) {
        return switch (join.joinType()) {
            case CROSS -> crossJoin(join);
            case NATURAL -> naturalJoin(join);
            case THETA -> thetaJoin(join);
            case FULL_OUTER -> fullOuterJoin(join);
            case LEFT_OUTER -> leftOuterJoin(join);
            case RIGHT_OUTER -> rightOuterJoin(join);
        };
    }

    @Override
    public final T visit(SetOperationNode setOperation) {
        return switch (setOperation.setOperator()) {
            case UNION -> union(setOperation);
            case DIFFERENCE -> difference(setOperation);
            case INTERSECT -> intersect(setOperation);
        };
    }

    @Override
    public final T visit(PrimaryKeyNode primaryKey) {
        return primaryKey(primaryKey);
    }

    @Override
    public final T visit(MultivaluedDependencyNode dependency) {
        return multivaluedDependency(dependency);
    }

    @Override
    public final T visit(FunctionalDependencyNode dependency) {
        return functionalDependency(dependency);
    }

    @Override
    public final T visit(InclusionDependencyNode dependency) {
        return switch (dependency.inclusionType()) {
            case EQUIVALENCE -> inclusionEquivalence(dependency);
            case SUBSUMPTION -> inclusionSubsumption(dependency);
        };
    }
}
