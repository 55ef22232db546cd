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
import org.rapt.engine.plan.RelationNode;
import org.rapt.engine.plan.RenameNode;
import org.rapt.engine.plan.SelectNode;
import org.rapt.engine.plan.SetOperationNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders node trees as LaTeX qtree diagrams: {@code \Tree[.$label$ children ]}.
 *
 * Relation and attribute names are escaped for math mode; condition operands are rendered as written.
 */
public final class QTreeGenerator extends Translator<String> {

    static final String TREE = "\\Tree";

    static final String SELECT_OP = "\\sigma";
    static final String PROJECT_OP = "\\pi";
    static final String RENAME_OP = "\\rho";
    static final String CROSS_JOIN_OP = "\\times";
    static final String THETA_JOIN_OP = "\\times";
    static final String NATURAL_JOIN_OP = "\\bowtie";
    static final String FULL_OUTER_JOIN_OP = "\\fullouterjoin";
    static final String LEFT_OUTER_JOIN_OP = "\\leftouterjoin";
    static final String RIGHT_OUTER_JOIN_OP = "\\rightouterjoin";
    static final String UNION_OP = "\\cup";
    static final String DIFFERENCE_OP = "-";
    static final String INTERSECT_OP = "\\cap";
    static final String PRIMARY_KEY_OP = "\\text{pk}";
    static final String MULTIVALUED_DEPENDENCY_OP = "\\text{mvd}";
    static final String FUNCTIONAL_DEPENDENCY_OP = "\\rightarrow";
    static final String INCLUSION_EQUIVALENCE_OP = "\\equiv";
    static final String INCLUSION_SUBSUMPTION_OP = "\\subseteq";

    private static final String LIST_SEPARATOR = ",\\,";

    /**
     * Renders one statement's tree, starting with {@code \Tree}.
     */
    public String generate(RaNode node) {
        return TREE + translate(node);
    }

    public List<String> generateAll(List<RaNode> nodes) {
        return nodes.stream().map(this::generate).collect(Collectors.toList());
    }

    // ==================== Relations and unary operators ====================

    @Override
    protected String relation(RelationNode node) {
        return leaf(escape(node.name()));
    }

    @Override
    protected String definition(DefinitionNode node) {
        return leaf(escape(node.name()) + "(" + list(node.attributes().names()) + ")");
    }

    @Override
    protected String select(SelectNode node) {
        return branch(SELECT_OP + "_{" + node.condition().toLatex() + "}", node.child());
    }

    @Override
    protected String project(ProjectNode node) {
        return branch(PROJECT_OP + "_{" + list(node.attributes().names()) + "}", node.child());
    }

    @Override
    protected String rename(RenameNode node) {
        String name = node.name() == null ? "" : escape(node.name());
        return branch(RENAME_OP + "_{" + name + "(" + list(node.attributes().names()) + ")}", node.child());
    }

    @Override
    protected String assign(AssignNode node) {
        return branch(escape(node.name()) + "(" + list(node.attributes().names()) + ")", node.child());
    }

    // ==================== Joins ====================

    @Override
    protected String crossJoin(JoinNode node) {
        return join(CROSS_JOIN_OP, node);
    }

    @Override
    protected String naturalJoin(JoinNode node) {
        return join(NATURAL_JOIN_OP, node);
    }

    @Override
    protected String thetaJoin(JoinNode node) {
        return join(THETA_JOIN_OP, node);
    }

    @Override
    protected String fullOuterJoin(JoinNode node) {
        return join(FULL_OUTER_JOIN_OP, node);
    }

    @Override
    protected String leftOuterJoin(JoinNode node) {
        return join(LEFT_OUTER_JOIN_OP, node);
    }

    @Override
    protected String rightOuterJoin(JoinNode node) {
        return join(RIGHT_OUTER_JOIN_OP, node);
    }

    private String join(String symbol, JoinNode node) {
        String label = node.condition() == null ? symbol : symbol + "_{" + node.condition().toLatex() + "}";
        return branch(label, node.left(), node.right());
    }

    // ==================== Set operations ====================

    @Override
    protected String union(SetOperationNode node) {
        return branch(UNION_OP, node.left(), node.right());
    }

    @Override
    protected String difference(SetOperationNode node) {
        return branch(DIFFERENCE_OP, node.left(), node.right());
    }

    @Override
    protected String intersect(SetOperationNode node) {
        return branch(INTERSECT_OP, node.left(), node.right());
    }

    // ==================== Dependencies ====================

    @Override
    protected String primaryKey(PrimaryKeyNode node) {
        return leaf(PRIMARY_KEY_OP + "_{" + list(node.attributeNames()) + "}(" + escape(node.relationName()) + ")");
    }

    @Override
    protected String multivaluedDependency(MultivaluedDependencyNode node) {
        return leaf(MULTIVALUED_DEPENDENCY_OP + "_{" + list(node.attributeNames()) + "}(" + target(node.target()) + ")");
    }

    @Override
    protected String functionalDependency(FunctionalDependencyNode node) {
        List<String> attributes = node.attributeNames();
        return leaf(target(node.target()) + " : " + escape(attributes.get(0))
                + " " + FUNCTIONAL_DEPENDENCY_OP + " " + escape(attributes.get(1)));
    }

    @Override
    protected String inclusionEquivalence(InclusionDependencyNode node) {
        return inclusion(INCLUSION_EQUIVALENCE_OP, node);
    }

    @Override
    protected String inclusionSubsumption(InclusionDependencyNode node) {
        return inclusion(INCLUSION_SUBSUMPTION_OP, node);
    }

    private String inclusion(String symbol, InclusionDependencyNode node) {
        List<String> attributes = node.attributeNames();
        return leaf(target(node.left()) + "[" + escape(attributes.get(0)) + "] " + symbol + " "
                + target(node.right()) + "[" + escape(attributes.get(1)) + "]");
    }

    /**
     * A dependency target: {@code r}, or {@code \sigma_{cond} (r)} for a selection.
     */
    private String target(RaNode node) {
        if (node instanceof SelectNode select) {
            return SELECT_OP + "_{" + select.condition().toLatex() + "} (" + escape(select.child().name()) + ")";
        }
        return escape(node.name());
    }

    // ==================== Helpers ====================

    private static String leaf(String label) {
        return "[.$" + label + "$ ]";
    }

    private String branch(String label, RaNode... children) {
        StringBuilder sb = new StringBuilder("[.$").append(label).append("$ ");
        for (RaNode child : children) {
            sb.append(translate(child)).append(' ');
        }
        return sb.append(']').toString();
    }

    private static String list(List<String> names) {
        return names.stream().map(QTreeGenerator::escape).collect(Collectors.joining(LIST_SEPARATOR));
    }

    static String escape(String name) {
        return name.replace("_", "\\_");
    }
}
