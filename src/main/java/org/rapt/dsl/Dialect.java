package org.rapt.dsl;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static org.rapt.dsl.SyntaxToken.*;

/**
 * Grammar dialects. Each dialect activates its parent's tokens plus its own.
 */
public enum Dialect {
    CORE(null, EnumSet.of(
            TERMINATOR, DELIMITER, PARAMS_START, PARAMS_STOP, PAREN_LEFT, PAREN_RIGHT, QUALIFIER,
            NOT, AND, OR, EQUAL, NOT_EQUAL, NOT_EQUAL_ALT,
            LESS_THAN, LESS_THAN_EQUAL, GREATER_THAN, GREATER_THAN_EQUAL,
            PROJECT, RENAME, SELECT, ASSIGN, JOIN, DIFFERENCE, UNION)),
    EXTENDED(CORE, EnumSet.of(
            THETA_JOIN, NATURAL_JOIN, FULL_OUTER_JOIN, LEFT_OUTER_JOIN, RIGHT_OUTER_JOIN, INTERSECT, DEFINED)),
    DEPENDENCY(EXTENDED, EnumSet.of(
            PRIMARY_KEY, MULTIVALUED_DEPENDENCY, FUNCTIONAL_DEPENDENCY, INCLUSION_EQUIVALENCE, INCLUSION_SUBSUMPTION)),
    THREE_VALUED(CORE, EnumSet.of(DEFINED));

    private final Dialect parent;
    private final Set<SyntaxToken> tokens;

    Dialect(Dialect parent, EnumSet<SyntaxToken> own) {
        this.parent = parent;
        EnumSet<SyntaxToken> all = EnumSet.copyOf(own);
        if (parent != null) {
            all.addAll(parent.tokens);
        }
        this.tokens = Collections.unmodifiableSet(all);
    }

    public Dialect parent() {
        return parent;
    }

    public Set<SyntaxToken> tokens() {
        return tokens;
    }

    public boolean supports(SyntaxToken token) {
        return tokens.contains(token);
    }
}
