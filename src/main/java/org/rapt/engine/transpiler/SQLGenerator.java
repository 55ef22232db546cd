package org.rapt.engine.transpiler;

import org.rapt.engine.plan.AssignNode;
import org.rapt.engine.plan.Attribute;
import org.rapt.engine.plan.AttributeList;
import org.rapt.engine.plan.Condition;
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
import org.rapt.engine.plan.TranslationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Transpiles node trees into SQL with bag semantics: duplicates are kept and set operations use ALL.
 *
 * Definitions and multivalued, functional and inclusion dependencies have no SQL form and translate
 * to nothing.
 */
public class SQLGenerator extends Translator<SqlStatement> {

    private final Map<RaNode, String> syntheticNames = new IdentityHashMap<>();

    /**
     * Generates SQL for one statement's tree.
     *
     * @return the SQL text, or empty when the node has no SQL form
     */
    public Optional<String> generate(RaNode node) {
        syntheticNames.clear();
        return Optional.ofNullable(translate(node)).map(SqlStatement::toSql);
    }

    /**
     * Generates SQL for a batch, skipping statements with no SQL form.
     */
    public List<String> generateAll(List<RaNode> nodes) {
        List<String> statements = new ArrayList<>();
        for (RaNode node : nodes) {
            generate(node).ifPresent(statements::add);
        }
        return statements;
    }

    protected boolean isDistinct() {
        return false;
    }

    protected String setOperatorSql(SetOperationNode.SetOperator operator) {
        return operator.toSql() + " ALL";
    }

    // ==================== Relations and unary operators ====================

    @Override
    protected SqlStatement relation(RelationNode node) {
        return SqlQuery.of(node.attributes().toString(), node.name(), isDistinct());
    }

    @Override
    protected SqlStatement definition(DefinitionNode node) {
        return null;
    }

    @Override
    protected SqlStatement select(SelectNode node) {
        SqlQuery query = query(node.child());
        String condition = renderCondition(node.condition(), node.attributes(), query.columns());
        String where = query.where().isEmpty() ? condition : "(" + query.where() + ") AND (" + condition + ")";
        query = query.withWhere(where);
        if (query.select().isEmpty()) {
            query = query.withSelect(selectList(node.attributes(), query.columns()));
        }
        return query;
    }

    @Override
    protected SqlStatement project(ProjectNode node) {
        SqlQuery query = query(node.child());
        if (query.columns().isEmpty()) {
            return query.withSelect(node.attributes().toString());
        }
        List<Attribute> available = node.child().attributes().asList();
        List<String> columns = new ArrayList<>(node.attributes().size());
        for (Attribute attribute : node.attributes()) {
            columns.add(query.columns().get(available.indexOf(attribute)));
        }
        return query.withSelect(String.join(", ", columns)).withColumns(columns);
    }

    @Override
    protected SqlStatement rename(RenameNode node) {
        SqlQuery child = query(node.child());
        String alias = aliasFor(node) + "(" + String.join(", ", node.attributes().names()) + ")";
        return SqlQuery.of(node.attributes().toString(), "(" + child.toSql() + ") AS " + alias, isDistinct());
    }

    @Override
    protected SqlStatement assign(AssignNode node) {
        String table = node.name() + "(" + String.join(", ", node.attributes().names()) + ")";
        return query(node.child()).withPrefix("CREATE TEMPORARY TABLE " + table + " AS ");
    }

    // ==================== Joins ====================

    @Override
    protected SqlStatement crossJoin(JoinNode node) {
        return join(node);
    }

    @Override
    protected SqlStatement naturalJoin(JoinNode node) {
        return join(node);
    }

    @Override
    protected SqlStatement thetaJoin(JoinNode node) {
        return join(node);
    }

    @Override
    protected SqlStatement fullOuterJoin(JoinNode node) {
        return join(node);
    }

    @Override
    protected SqlStatement leftOuterJoin(JoinNode node) {
        return join(node);
    }

    @Override
    protected SqlStatement rightOuterJoin(JoinNode node) {
        return join(node);
    }

    private SqlStatement join(JoinNode node) {
        JoinOperand left = joinOperand(node.left(), false);
        JoinOperand right = joinOperand(node.right(), true);

        List<String> columns = List.of();
        if (!left.columns().isEmpty() || !right.columns().isEmpty()) {
            columns = new ArrayList<>(left.references(node.left()));
            List<String> rightReferences = right.references(node.right());
            Set<String> leftNames = Set.copyOf(node.left().attributes().names());
            for (int i = 0; i < rightReferences.size(); i++) {
                boolean merged = node.joinType() == JoinNode.JoinType.NATURAL
                        && leftNames.contains(node.right().attributes().get(i).name());
                if (!merged) {
                    columns.add(rightReferences.get(i));
                }
            }
        }

        StringBuilder from = new StringBuilder()
                .append(left.from())
                .append(' ').append(node.joinType().toSql()).append(' ')
                .append(right.from());
        if (node.condition() != null) {
            from.append(" ON ").append(renderCondition(node.condition(), node.attributes(), columns));
        }
        return SqlQuery.of(selectList(node.attributes(), columns), from.toString(), isDistinct())
                .withColumns(columns);
    }

    /**
     * Relations, joins and set operations are inlined through their FROM clause; anything else becomes
     * a derived table. A derived table whose attributes cannot be reached through its alias gets a column
     * list, and its attributes are referenced as {@code alias.column}.
     */
    private JoinOperand joinOperand(RaNode side, boolean rightSide) {
        SqlQuery query = query(side);
        if (side instanceof RelationNode || side instanceof SetOperationNode) {
            return new JoinOperand(query.from(), query.columns());
        }
        if (side instanceof JoinNode) {
            String from = rightSide ? "(" + query.from() + ")" : query.from();
            return new JoinOperand(from, query.columns());
        }

        String alias = aliasFor(side);
        String derived = "(" + query.toSql() + ") AS " + alias;
        if (query.columns().isEmpty() && reachableThroughAlias(side.attributes(), alias)) {
            return new JoinOperand(derived, List.of());
        }
        List<String> names = derivedColumnNames(side.attributes());
        List<String> columns = new ArrayList<>(names.size());
        for (String name : names) {
            columns.add(alias + "." + name);
        }
        return new JoinOperand(derived + "(" + String.join(", ", names) + ")", columns);
    }

    private static boolean reachableThroughAlias(AttributeList attributes, String alias) {
        Set<String> names = new HashSet<>();
        for (Attribute attribute : attributes) {
            if (attribute.relation() != null && !attribute.relation().equals(alias)) {
                return false;
            }
            if (!names.add(attribute.name())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Column names for a derived table: attribute names, qualified as {@code relation_name} where a name
     * occurs more than once.
     */
    private static List<String> derivedColumnNames(AttributeList attributes) {
        Map<String, Integer> occurrences = new HashMap<>();
        for (Attribute attribute : attributes) {
            occurrences.merge(attribute.name(), 1, Integer::sum);
        }
        Set<String> used = new HashSet<>();
        List<String> names = new ArrayList<>(attributes.size());
        for (Attribute attribute : attributes) {
            String candidate = occurrences.get(attribute.name()) > 1 && attribute.relation() != null
                    ? attribute.relation() + "_" + attribute.name()
                    : attribute.name();
            String name = candidate;
            for (int n = 2; !used.add(name); n++) {
                name = candidate + "_" + n;
            }
            names.add(name);
        }
        return names;
    }

    /**
     * A FROM clause fragment and the references to the side's attributes, empty for qualified names.
     */
    private record JoinOperand(String from, List<String> columns) {

        List<String> references(RaNode side) {
            return columns.isEmpty() ? side.attributes().prefixedNames() : columns;
        }
    }

    // ==================== Set operations ====================

    @Override
    protected SqlStatement union(SetOperationNode node) {
        return setOperation(node);
    }

    @Override
    protected SqlStatement difference(SetOperationNode node) {
        return setOperation(node);
    }

    @Override
    protected SqlStatement intersect(SetOperationNode node) {
        return setOperation(node);
    }

    private SqlStatement setOperation(SetOperationNode node) {
        String from = "(" + query(node.left()).toSql()
                + " " + setOperatorSql(node.setOperator()) + " "
                + query(node.right()).toSql() + ") AS " + aliasFor(node);
        return SqlQuery.of(node.attributes().toString(), from, isDistinct());
    }

    // ==================== Dependencies ====================

    @Override
    protected SqlStatement primaryKey(PrimaryKeyNode node) {
        return new AlterTableStatement(node.relationName(), node.attributeNames());
    }

    @Override
    protected SqlStatement multivaluedDependency(MultivaluedDependencyNode node) {
        return null;
    }

    @Override
    protected SqlStatement functionalDependency(FunctionalDependencyNode node) {
        return null;
    }

    @Override
    protected SqlStatement inclusionEquivalence(InclusionDependencyNode node) {
        return null;
    }

    @Override
    protected SqlStatement inclusionSubsumption(InclusionDependencyNode node) {
        return null;
    }

    // ==================== Helpers ====================

    private static String selectList(AttributeList attributes, List<String> columns) {
        return columns.isEmpty() ? attributes.toString() : String.join(", ", columns);
    }

    /**
     * Renders a condition, rewriting attribute references when the scope references attributes through
     * derived table aliases.
     */
    private static String renderCondition(Condition condition, AttributeList attributes, List<String> columns) {
        if (columns.isEmpty()) {
            return condition.toSql();
        }
        return condition.toSql(reference -> columns.get(attributes.indexOf(reference)));
    }

    private SqlQuery query(RaNode node) {
        SqlStatement statement = translate(node);
        if (statement instanceof SqlQuery query) {
            return query;
        }
        throw new TranslationException(node.operator() + " cannot be used as a subquery");
    }

    /**
     * The node's name, or a name unique within the current statement.
     */
    private String aliasFor(RaNode node) {
        if (node.name() != null && !node.name().isEmpty()) {
            return node.name();
        }
        return syntheticNames.computeIfAbsent(node, n -> "_" + (syntheticNames.size() + 1));
    }
}
