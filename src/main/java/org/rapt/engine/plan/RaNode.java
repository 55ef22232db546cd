package org.rapt.engine.plan;

import java.util.List;

/**
 * A node of the relational algebra tree built for one statement.
 * Nodes are immutable, own their children exclusively, and compare structurally.
 */
public sealed interface RaNode
        permits RelationNode, DefinitionNode, SelectNode, ProjectNode, RenameNode, AssignNode,
        JoinNode, SetOperationNode,
        PrimaryKeyNode, MultivaluedDependencyNode, FunctionalDependencyNode, InclusionDependencyNode {

    Operator operator();

    /**
     * The relation name this node exposes, or null for joins, set operations and dependencies.
     */
    String name();

    AttributeList attributes();

    default List<RaNode> children() {
        return List.of();
    }

    <T> T accept(RaNodeVisitor<T> visitor);
}
