package org.rapt.engine;

import org.rapt.dsl.Dialect;
import org.rapt.dsl.RaParser;
import org.rapt.dsl.Statement;
import org.rapt.dsl.Syntax;
import org.rapt.dsl.TreeBuilder;
import org.rapt.engine.plan.RaNode;
import org.rapt.engine.store.Schema;
import org.rapt.engine.transpiler.QTreeGenerator;
import org.rapt.engine.transpiler.SQLGenerator;
import org.rapt.engine.transpiler.SetSemanticsSQLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles batches of relational algebra statements into node trees, SQL or qtree diagrams.
 *
 * <pre>
 * Rapt rapt = new Rapt();
 * List&lt;String&gt; sql = rapt.toSql("\\project_{a1} alpha;", Map.of("alpha", List.of("a1", "a2")));
 * </pre>
 *
 * Statements of a batch are compiled in order against one schema: a relation assigned or defined by a
 * statement is visible to the following ones. The first error aborts the batch.
 * Instances are immutable and may be shared; every call works on its own schema.
 */
public final class Rapt {

    private static final Logger logger = LoggerFactory.getLogger(Rapt.class);

    private final Syntax syntax;
    private final Dialect dialect;
    private final boolean bagSemantics;

    public Rapt() {
        this(builder());
    }

    private Rapt(Builder builder) {
        this.syntax = builder.syntax;
        this.dialect = builder.dialect;
        this.bagSemantics = builder.bagSemantics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Syntax syntax() {
        return syntax;
    }

    public Dialect dialect() {
        return dialect;
    }

    public boolean usesBagSemantics() {
        return bagSemantics;
    }

    /**
     * Parses a batch without building trees.
     *
     * @throws org.rapt.dsl.RaParseException if any statement cannot be parsed
     */
    public List<Statement> parse(String input) {
        Objects.requireNonNull(input, "Input cannot be null");
        List<Statement> statements = RaParser.parse(input, syntax, dialect);
        logger.debug("Parsed {} statement(s) with {} dialect", statements.size(), dialect);
        return statements;
    }

    public List<RaNode> toSyntaxTree(String input, Map<String, ? extends List<String>> relations) {
        return toSyntaxTree(input, new Schema(relations));
    }

    /**
     * Builds one tree per statement; definitions and assignments are registered in {@code schema}.
     */
    public List<RaNode> toSyntaxTree(String input, Schema schema) {
        return new TreeBuilder(schema).build(parse(input));
    }

    /**
     * Translates a batch to SQL with this instance's semantics.
     */
    public List<String> toSql(String input, Map<String, ? extends List<String>> relations) {
        return toSql(input, relations, bagSemantics);
    }

    /**
     * Translates a batch to SQL. Statements without an SQL form are left out of the result.
     */
    public List<String> toSql(String input, Map<String, ? extends List<String>> relations, boolean useBagSemantics) {
        List<RaNode> trees = toSyntaxTree(input, relations);
        SQLGenerator generator = useBagSemantics ? new SQLGenerator() : new SetSemanticsSQLGenerator();
        List<String> sql = generator.generateAll(trees);
        logger.debug("Translated {} tree(s) to {} SQL statement(s), bag semantics: {}",
                trees.size(), sql.size(), useBagSemantics);
        return sql;
    }

    /**
     * Translates a batch to qtree diagrams, one per statement.
     */
    public List<String> toQtree(String input, Map<String, ? extends List<String>> relations) {
        return new QTreeGenerator().generateAll(toSyntaxTree(input, relations));
    }

    public static final class Builder {

        private Syntax syntax = Syntax.defaults();
        private Dialect dialect = Dialect.DEPENDENCY;
        private boolean bagSemantics = false;

        private Builder() {
        }

        public Builder syntax(Syntax syntax) {
            this.syntax = Objects.requireNonNull(syntax, "Syntax cannot be null");
            return this;
        }

        public Builder dialect(Dialect dialect) {
            this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
            return this;
        }

        public Builder bagSemantics(boolean bagSemantics) {
            this.bagSemantics = bagSemantics;
            return this;
        }

        public Rapt build() {
            return new Rapt(this);
        }
    }
}
