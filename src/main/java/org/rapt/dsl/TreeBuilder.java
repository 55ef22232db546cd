package org.rapt.dsl;

import org.rapt.engine.plan.AssignNode;
import org.rapt.engine.plan.DefinitionNode;
import org.rapt.engine.plan.FunctionalDependencyNode;
import org.rapt.engine.plan.InclusionDependencyNode;
import org.rapt.engine.plan.InclusionDependencyNode.InclusionType;
import org.rapt.engine.plan.JoinNode;
import org.rapt.engine.plan.JoinNode.JoinType;
import org.rapt.engine.plan.MultivaluedDependencyNode;
import org.rapt.engine.plan.PrimaryKeyNode;
import org.rapt.engine.plan.ProjectNode;
import org.rapt.engine.plan.RaNode;
import org.rapt.engine.plan.RelationNode;
import org.rapt.engine.plan.RenameNode;
import org.rapt.engine.plan.SelectNode;
import org.rapt.engine.plan.SetOperationNode;
import org.rapt.engine.plan.SetOperationNode.SetOperator;
import org.rapt.engine.store.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds validated node trees from parse results.
 *
 * Statements must be built in textual order: definitions and assignments register relations in the
 * schema that later statements may reference.
 */
public final class TreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final Schema schema;

    public TreeBuilder(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
    }

    public List<RaNode> build(List<Statement> statements) {
        List<RaNode> nodes = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            nodes.add(build(statement));
        }
        return nodes;
    }

    public RaNode build(Statement statement) {
        RaNode node;
        if (statement instanceof ExpressionStatement expression) {
            node = build(expression.expression());
        } else if (statement instanceof AssignmentStatement assignment) {
            node = AssignNode.of(build(assignment.expression()), assignment.name(), assignment.attributes(), schema);
            logger.debug("Registered relation {}({})", node.name(), node.attributes());
        } else if (statement instanceof DefinitionStatement definition) {
            node = DefinitionNode.define(definition.name(), definition.attributes(), schema);
            logger.debug("Registered relation {}({})", node.name(), node.attributes());
        } else if (statement instanceof DependencyStatement dependency) {
            node = buildDependency(dependency);
        } else {
            throw new IllegalStateException("Unknown statement: " + statement);
        }
        logger.debug("Built {} from: {}", node.operator(), statement);
        return node;
    }

    public RaNode build(RaExpression expression) {
        if (expression instanceof RelationReference relation) {
            return RelationNode.of(relation.name(), schema);
        }
        if (expression instanceof ProjectExpression project) {
            return ProjectNode.of(build(project.operand()), project.attributes());
        }
        if (expression instanceof SelectExpression select) {
            return new SelectNode(build(select.operand()), select.condition());
        }
        if (expression instanceof RenameExpression rename) {
            return RenameNode.of(build(rename.operand()), rename.name(), rename.attributes(), schema);
        }
        if (expression instanceof OperatorChain chain) {
            RaNode node = build(chain.first());
            for (ChainLink link : chain.links()) {
                node = combine(node, link);
            }
            return node;
        }
        throw new IllegalStateException("Unknown expression: " + expression);
    }

    private RaNode combine(RaNode left, ChainLink link) {
        RaNode right = build(link.operand());
        switch (link.operator()) {
            case JOIN:
                return JoinNode.cross(left, right);
            case NATURAL_JOIN:
                return JoinNode.natural(left, right);
            case THETA_JOIN:
                return JoinNode.theta(left, right, link.condition());
            case FULL_OUTER_JOIN:
                return JoinNode.of(JoinType.FULL_OUTER, left, right, link.condition());
            case LEFT_OUTER_JOIN:
                return JoinNode.of(JoinType.LEFT_OUTER, left, right, link.condition());
            case RIGHT_OUTER_JOIN:
                return JoinNode.of(JoinType.RIGHT_OUTER, left, right, link.condition());
            case UNION:
                return SetOperationNode.of(SetOperator.UNION, left, right);
            case DIFFERENCE:
                return SetOperationNode.of(SetOperator.DIFFERENCE, left, right);
            case INTERSECT:
                return SetOperationNode.of(SetOperator.INTERSECT, left, right);
            default:
                throw new IllegalStateException("Not a binary operator: " + link.operator());
        }
    }

    private RaNode buildDependency(DependencyStatement dependency) {
        List<String> attributes = dependency.attributes();
        switch (dependency.kind()) {
            case PRIMARY_KEY:
                return new PrimaryKeyNode(RelationNode.of(dependency.targets().get(0).relation(), schema), attributes);
            case MULTIVALUED_DEPENDENCY:
                return new MultivaluedDependencyNode(buildTarget(dependency.targets().get(0)), attributes);
            case FUNCTIONAL_DEPENDENCY:
                return new FunctionalDependencyNode(buildTarget(dependency.targets().get(0)), attributes);
            case INCLUSION_EQUIVALENCE:
                return new InclusionDependencyNode(InclusionType.EQUIVALENCE,
                        buildTarget(dependency.targets().get(0)), buildTarget(dependency.targets().get(1)), attributes);
            case INCLUSION_SUBSUMPTION:
                return new InclusionDependencyNode(InclusionType.SUBSUMPTION,
                        buildTarget(dependency.targets().get(0)), buildTarget(dependency.targets().get(1)), attributes);
            default:
                throw new IllegalStateException("Not a dependency: " + dependency.kind());
        }
    }

    private RaNode buildTarget(DependencyTarget target) {
        RelationNode relation = RelationNode.of(target.relation(), schema);
        return target.isSelection() ? new SelectNode(relation, target.condition()) : relation;
    }
}
