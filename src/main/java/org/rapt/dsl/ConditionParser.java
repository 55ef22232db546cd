package org.rapt.dsl;

import org.rapt.dsl.Token.TokenType;
import org.rapt.engine.plan.BinaryCondition;
import org.rapt.engine.plan.BinaryConditionOperator;
import org.rapt.engine.plan.Condition;
import org.rapt.engine.plan.IdentityCondition;
import org.rapt.engine.plan.UnaryCondition;

import java.util.EnumMap;
import java.util.Map;

/**
 * Parses the conditions inside {@code _{...}} parameter blocks.
 *
 * Precedence from loosest to tightest: {@code or}, {@code and}, {@code not}, then comparisons,
 * {@code defined(x)} and parenthesized conditions. Both connectives are left-associative.
 */
final class ConditionParser {

    private static final Map<SyntaxToken, BinaryConditionOperator> COMPARATORS = new EnumMap<>(SyntaxToken.class);

    static {
        COMPARATORS.put(SyntaxToken.EQUAL, BinaryConditionOperator.EQUAL);
        COMPARATORS.put(SyntaxToken.NOT_EQUAL, BinaryConditionOperator.NOT_EQUAL);
        COMPARATORS.put(SyntaxToken.NOT_EQUAL_ALT, BinaryConditionOperator.NOT_EQUAL);
        COMPARATORS.put(SyntaxToken.LESS_THAN, BinaryConditionOperator.LESS_THAN);
        COMPARATORS.put(SyntaxToken.LESS_THAN_EQUAL, BinaryConditionOperator.LESS_THAN_EQUAL);
        COMPARATORS.put(SyntaxToken.GREATER_THAN, BinaryConditionOperator.GREATER_THAN);
        COMPARATORS.put(SyntaxToken.GREATER_THAN_EQUAL, BinaryConditionOperator.GREATER_THAN_EQUAL);
    }

    private final TokenStream tokens;

    ConditionParser(TokenStream tokens) {
        this.tokens = tokens;
    }

    Condition parse() {
        return parseOr();
    }

    private Condition parseOr() {
        Condition left = parseAnd();

        while (tokens.check(SyntaxToken.OR)) {
            tokens.advance();
            left = BinaryCondition.or(left, parseAnd());
        }

        return left;
    }

    private Condition parseAnd() {
        Condition left = parseNot();

        while (tokens.check(SyntaxToken.AND)) {
            tokens.advance();
            left = BinaryCondition.and(left, parseNot());
        }

        return left;
    }

    private Condition parseNot() {
        if (tokens.check(SyntaxToken.NOT)) {
            tokens.advance();
            return UnaryCondition.not(parseNot());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() {
        if (tokens.check(SyntaxToken.PAREN_LEFT)) {
            tokens.advance();
            Condition inner = parseOr();
            tokens.consume(SyntaxToken.PAREN_RIGHT, "Expected ')' to close condition");
            return inner;
        }

        if (tokens.check(SyntaxToken.DEFINED)) {
            tokens.advance();
            tokens.consume(SyntaxToken.PAREN_LEFT, "Expected '(' after defined");
            Condition operand = parseOperand();
            tokens.consume(SyntaxToken.PAREN_RIGHT, "Expected ')' after defined operand");
            return UnaryCondition.defined(operand);
        }

        Condition left = parseOperand();
        Token comparator = tokens.peek();
        BinaryConditionOperator operator = comparator.type() == TokenType.SYMBOL
                ? COMPARATORS.get(comparator.symbol())
                : null;
        if (operator == null) {
            throw tokens.error("Expected comparison operator");
        }
        tokens.advance();
        return new BinaryCondition(operator, left, parseOperand());
    }

    /**
     * An attribute reference, a string literal or a number.
     */
    private Condition parseOperand() {
        Token token = tokens.peek();
        if (token.type() == TokenType.STRING_LITERAL || token.type() == TokenType.NUMBER_LITERAL) {
            tokens.advance();
            return new IdentityCondition(token.value());
        }
        if (RaParser.isName(token)) {
            return new IdentityCondition(RaParser.parseAttributeReference(tokens));
        }
        throw tokens.error("Expected attribute reference or literal");
    }
}
