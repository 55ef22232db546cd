package org.rapt.engine.plan;

/**
 * Visitor over every {@link RaNode} kind.
 *
 * @param <T> The result type
 */
public interface RaNodeVisitor<T> {

    T visit(RelationNode relation);

    T visit(DefinitionNode definition);

    T visit(SelectNode select);

    T visit(ProjectNode project);

    T visit(RenameNode rename);

    T visit(AssignNode assign);

    T visit(JoinNode join);

    T visit(SetOperationNode setOperation);

    T visit(PrimaryKeyNode primaryKey);

    T visit(MultivaluedDependencyNode dependency);

    T visit(FunctionalDependencyNode dependency);

    T visit(InclusionDependencyNode dependency);
}
