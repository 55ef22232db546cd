package org.rapt.dsl;

import org.rapt.dsl.Token.TokenType;
import org.rapt.engine.plan.Condition;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.rapt.dsl.SyntaxToken.*;

/**
 * Parser for relational algebra statements.
 *
 * Parses input like:
 * <pre>
 * beta_prime(x, y) := \project_{b1, b2} beta;
 * \select_{a1 = b1} (alpha \join beta_prime) \difference gamma;
 * </pre>
 *
 * Unary operators bind tightest. Binary operators are grouped by precedence level, each level parsed as a
 * flat left-associative {@link OperatorChain}: joins, then intersect, then union and difference.
 */
public final class RaParser {

    private static final List<Set<SyntaxToken>> BINARY_PRECEDENCE = List.of(
            EnumSet.of(JOIN, NATURAL_JOIN, THETA_JOIN, FULL_OUTER_JOIN, LEFT_OUTER_JOIN, RIGHT_OUTER_JOIN),
            EnumSet.of(INTERSECT),
            EnumSet.of(UNION, DIFFERENCE));

    private static final Set<SyntaxToken> CONDITIONAL_JOINS =
            EnumSet.of(THETA_JOIN, FULL_OUTER_JOIN, LEFT_OUTER_JOIN, RIGHT_OUTER_JOIN);

    private static final Set<SyntaxToken> DEPENDENCIES = EnumSet.of(
            PRIMARY_KEY, MULTIVALUED_DEPENDENCY, FUNCTIONAL_DEPENDENCY, INCLUSION_EQUIVALENCE, INCLUSION_SUBSUMPTION);

    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private final TokenStream tokens;
    private final Dialect dialect;
    private final ConditionParser conditions;

    public RaParser(String source, List<Token> tokens, Dialect dialect) {
        this.tokens = new TokenStream(source, tokens);
        this.dialect = dialect;
        this.conditions = new ConditionParser(this.tokens);
    }

    /**
     * Parses statements with the default syntax and the dependency dialect.
     */
    public static List<Statement> parse(String input) {
        return parse(input, Syntax.defaults(), Dialect.DEPENDENCY);
    }

    public static List<Statement> parse(String input, Syntax syntax, Dialect dialect) {
        List<Token> tokens = new RaLexer(input, syntax, dialect).tokenize();
        return new RaParser(input, tokens, dialect).parseStatements();
    }

    /**
     * Parses one or more {@code ;}-terminated statements, consuming the whole input.
     */
    public List<Statement> parseStatements() {
        List<Statement> statements = new ArrayList<>();
        do {
            statements.add(parseStatement());
            tokens.consume(TERMINATOR, "Expected ';' at end of statement");
        } while (!tokens.isAtEnd());
        return statements;
    }

    private Statement parseStatement() {
        Token first = tokens.peek();
        if (first.type() == TokenType.SYMBOL && DEPENDENCIES.contains(first.symbol()) && tokens.peekAt(1).is(PARAMS_START)) {
            return parseDependency();
        }

        if (isName(first)) {
            Token second = tokens.peekAt(1);
            if (second.is(ASSIGN)) {
                String name = parseName();
                tokens.advance();
                return new AssignmentStatement(name, List.of(), parseExpression());
            }
            if (second.is(PAREN_LEFT)) {
                String name = parseName();
                List<String> attributes = parseNameList();
                if (tokens.check(ASSIGN)) {
                    tokens.advance();
                    return new AssignmentStatement(name, attributes, parseExpression());
                }
                return new DefinitionStatement(name, attributes);
            }
        }

        return new ExpressionStatement(parseExpression());
    }

    // ==================== Expressions ====================

    private RaExpression parseExpression() {
        return parseBinary(BINARY_PRECEDENCE.size() - 1);
    }

    private RaExpression parseBinary(int level) {
        if (level < 0) {
            return parseUnary();
        }

        RaExpression first = parseBinary(level - 1);
        List<ChainLink> links = new ArrayList<>();
        while (checkBinaryOperator(level)) {
            links.add(parseLink(level));
        }
        return links.isEmpty() ? first : new OperatorChain(first, links);
    }

    private boolean checkBinaryOperator(int level) {
        Token token = tokens.peek();
        return token.type() == TokenType.SYMBOL && BINARY_PRECEDENCE.get(level).contains(token.symbol());
    }

    private ChainLink parseLink(int level) {
        Token operatorToken = tokens.advance();
        SyntaxToken operator = operatorToken.symbol();
        Condition condition = null;

        // \join directly followed by a parameter block is a theta join
        if (operator == JOIN && dialect.supports(THETA_JOIN) && tokens.check(PARAMS_START)
                && operatorToken.isAdjacentTo(tokens.peek())) {
            operator = THETA_JOIN;
        }
        if (CONDITIONAL_JOINS.contains(operator)) {
            condition = parseConditionParameters(operatorToken);
        }

        return new ChainLink(operator, condition, parseBinary(level - 1));
    }

    private RaExpression parseUnary() {
        Token token = tokens.peek();

        if (token.is(PROJECT)) {
            tokens.advance();
            tokens.consumeAdjacent(PARAMS_START, token, "Expected '_{' after project");
            List<String> attributes = parseAttributeReferences();
            tokens.consume(PARAMS_STOP, "Expected '}' after project attributes");
            return new ProjectExpression(attributes, parseUnary());
        }

        if (token.is(SELECT)) {
            tokens.advance();
            Condition condition = parseConditionParameters(token);
            return new SelectExpression(condition, parseUnary());
        }

        if (token.is(RENAME)) {
            tokens.advance();
            tokens.consumeAdjacent(PARAMS_START, token, "Expected '_{' after rename");
            String name = tokens.check(PAREN_LEFT) ? null : parseName();
            List<String> attributes = tokens.check(PAREN_LEFT) ? parseNameList() : List.of();
            tokens.consume(PARAMS_STOP, "Expected '}' after rename parameters");
            return new RenameExpression(name, attributes, parseUnary());
        }

        return parsePrimary();
    }

    private RaExpression parsePrimary() {
        if (tokens.check(PAREN_LEFT)) {
            tokens.advance();
            RaExpression inner = parseExpression();
            tokens.consume(PAREN_RIGHT, "Expected ')' to close expression");
            return inner;
        }
        return new RelationReference(parseName());
    }

    private Condition parseConditionParameters(Token operatorToken) {
        tokens.consumeAdjacent(PARAMS_START, operatorToken, "Expected '_{' after '" + operatorToken.value() + "'");
        Condition condition = conditions.parse();
        tokens.consume(PARAMS_STOP, "Expected '}' after condition");
        return condition;
    }

    // ==================== Dependencies ====================

    private Statement parseDependency() {
        Token keyword = tokens.advance();
        SyntaxToken kind = keyword.symbol();
        tokens.consumeAdjacent(PARAMS_START, keyword, "Expected '_{' after '" + keyword.value() + "'");
        int attributesAt = tokens.peek().position();
        List<String> attributes = parseNames();
        tokens.consume(PARAMS_STOP, "Expected '}' after dependency attributes");

        if (kind != PRIMARY_KEY && attributes.size() != 2) {
            throw tokens.errorAt("'" + keyword.value() + "' expects exactly two attributes", attributesAt);
        }

        if (kind == PRIMARY_KEY) {
            return new DependencyStatement(kind, attributes, List.of(new DependencyTarget(parseName(), null)));
        }
        if (kind == MULTIVALUED_DEPENDENCY || kind == FUNCTIONAL_DEPENDENCY) {
            return new DependencyStatement(kind, attributes, List.of(parseDependencyTarget()));
        }

        tokens.consume(PAREN_LEFT, "Expected '(' before inclusion relations");
        DependencyTarget left = parseDependencyTarget();
        tokens.consume(DELIMITER, "Expected ',' between inclusion relations");
        DependencyTarget right = parseDependencyTarget();
        tokens.consume(PAREN_RIGHT, "Expected ')' after inclusion relations");
        return new DependencyStatement(kind, attributes, List.of(left, right));
    }

    private DependencyTarget parseDependencyTarget() {
        Token token = tokens.peek();
        if (token.is(SELECT)) {
            tokens.advance();
            Condition condition = parseConditionParameters(token);
            return new DependencyTarget(parseName(), condition);
        }
        return new DependencyTarget(parseName(), null);
    }

    // ==================== Names ====================

    /**
     * {@code (a, b, c)}: parenthesized, non-empty, comma separated names.
     */
    private List<String> parseNameList() {
        tokens.consume(PAREN_LEFT, "Expected '('");
        List<String> names = parseNames();
        tokens.consume(PAREN_RIGHT, "Expected ')' after attribute names");
        return names;
    }

    private List<String> parseNames() {
        List<String> names = new ArrayList<>();
        names.add(parseName());
        while (tokens.check(DELIMITER)) {
            tokens.advance();
            names.add(parseName());
        }
        return names;
    }

    private List<String> parseAttributeReferences() {
        List<String> references = new ArrayList<>();
        references.add(parseAttributeReference(tokens));
        while (tokens.check(DELIMITER)) {
            tokens.advance();
            references.add(parseAttributeReference(tokens));
        }
        return references;
    }

    private String parseName() {
        if (!isName(tokens.peek())) {
            throw tokens.error("Expected name");
        }
        return tokens.advance().value();
    }

    /**
     * {@code attr} or {@code relation.attr}, written without inner whitespace.
     */
    static String parseAttributeReference(TokenStream tokens) {
        if (!isName(tokens.peek())) {
            throw tokens.error("Expected attribute reference");
        }
        Token first = tokens.advance();
        Token dot = tokens.peek();
        if (!dot.is(QUALIFIER) || !first.isAdjacentTo(dot)) {
            return first.value();
        }
        tokens.advance();
        Token second = tokens.peek();
        if (!isName(second) || !dot.isAdjacentTo(second)) {
            throw tokens.error("Expected attribute name after '" + first.value() + dot.value() + "'");
        }
        tokens.advance();
        return first.value() + "." + second.value();
    }

    /**
     * Identifiers, and dependency keywords used as plain names such as a relation called {@code fd}.
     */
    static boolean isName(Token token) {
        if (token.type() == TokenType.IDENTIFIER) {
            return true;
        }
        return token.type() == TokenType.SYMBOL && DEPENDENCIES.contains(token.symbol())
                && NAME.matcher(token.value()).matches();
    }
}
