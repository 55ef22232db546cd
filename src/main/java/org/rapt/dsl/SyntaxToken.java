package org.rapt.dsl;

import java.util.Locale;

/**
 * Every token of the relational algebra language that is recognized by a configurable literal.
 * The default literal of each token can be replaced through {@link Syntax}.
 */
public enum SyntaxToken {
    // Delimiters
    TERMINATOR(";"),
    DELIMITER(","),
    PARAMS_START("_{"),
    PARAMS_STOP("}"),
    PAREN_LEFT("("),
    PAREN_RIGHT(")"),
    QUALIFIER("."),

    // Conditions
    NOT("not"),
    AND("and"),
    OR("or"),
    EQUAL("="),
    NOT_EQUAL("!="),
    NOT_EQUAL_ALT("<>"),
    LESS_THAN("<"),
    LESS_THAN_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_EQUAL(">="),
    DEFINED("defined"),

    // Core operators
    PROJECT("\\project"),
    RENAME("\\rename"),
    SELECT("\\select"),
    ASSIGN(":="),
    JOIN("\\join"),
    DIFFERENCE("\\difference"),
    UNION("\\union"),

    // Extended operators
    THETA_JOIN("\\theta_join"),
    NATURAL_JOIN("\\natural_join"),
    FULL_OUTER_JOIN("\\full_outer_join"),
    LEFT_OUTER_JOIN("\\left_outer_join"),
    RIGHT_OUTER_JOIN("\\right_outer_join"),
    INTERSECT("\\intersect"),

    // Dependencies
    PRIMARY_KEY("pk"),
    MULTIVALUED_DEPENDENCY("mvd"),
    FUNCTIONAL_DEPENDENCY("fd"),
    INCLUSION_EQUIVALENCE("inc="),
    INCLUSION_SUBSUMPTION("inc⊆");

    private final String defaultLiteral;

    SyntaxToken(String defaultLiteral) {
        this.defaultLiteral = defaultLiteral;
    }

    public String defaultLiteral() {
        return defaultLiteral;
    }

    /**
     * The configuration key of this token, e.g. {@code natural_join}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyntaxToken fromKey(String key) {
        for (SyntaxToken token : values()) {
            if (token.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return token;
            }
        }
        throw new IllegalArgumentException("Unknown syntax token: " + key);
    }
}
