package org.rapt.dsl;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable table of the literal recognized for each {@link SyntaxToken}.
 *
 * <pre>
 * Syntax syntax = Syntax.builder()
 *         .override(SyntaxToken.PROJECT, "\\pi")
 *         .override(SyntaxToken.SELECT, "\\sigma")
 *         .build();
 * </pre>
 */
public final class Syntax {

    private static final Syntax DEFAULTS = builder().build();

    private final Map<SyntaxToken, String> literals;

    private Syntax(Map<SyntaxToken, String> literals) {
        this.literals = Collections.unmodifiableMap(new EnumMap<>(literals));
    }

    public static Syntax defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a syntax from defaults overridden by the given properties.
     * Keys are token keys such as {@code project} or {@code natural_join}.
     *
     * @throws IllegalArgumentException on an unknown key or an invalid literal
     */
    public static Syntax fromProperties(Properties properties) {
        Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            builder.override(SyntaxToken.fromKey(key), properties.getProperty(key).trim());
        }
        return builder.build();
    }

    public String literal(SyntaxToken token) {
        return literals.get(token);
    }

    public Map<SyntaxToken, String> literals() {
        return literals;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.literals.putAll(literals);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Syntax other && literals.equals(other.literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return "Syntax" + literals;
    }

    public static final class Builder {

        private final Map<SyntaxToken, String> literals = new EnumMap<>(SyntaxToken.class);

        private Builder() {
            for (SyntaxToken token : SyntaxToken.values()) {
                literals.put(token, token.defaultLiteral());
            }
        }

        public Builder override(SyntaxToken token, String literal) {
            Objects.requireNonNull(token, "Token cannot be null");
            Objects.requireNonNull(literal, "Literal cannot be null");
            literals.put(token, literal);
            return this;
        }

        public Syntax build() {
            Map<String, SyntaxToken> seen = new HashMap<>();
            for (Map.Entry<SyntaxToken, String> entry : literals.entrySet()) {
                String literal = entry.getValue();
                if (literal.isEmpty()) {
                    throw new IllegalArgumentException("Literal for '" + entry.getKey().key() + "' cannot be empty");
                }
                if (literal.chars().anyMatch(Character::isWhitespace)) {
                    throw new IllegalArgumentException(
                            "Literal for '" + entry.getKey().key() + "' cannot contain whitespace: '" + literal + "'");
                }
                SyntaxToken clash = seen.put(literal.toLowerCase(Locale.ROOT), entry.getKey());
                if (clash != null) {
                    throw new IllegalArgumentException("Tokens '" + clash.key() + "' and '" + entry.getKey().key()
                            + "' share the literal '" + literal + "'");
                }
            }
            return new Syntax(literals);
        }
    }
}
