package org.rapt.dsl;

/**
 * A token produced by {@link RaLexer}.
 *
 * @param type     The token type
 * @param symbol   The matched syntax token, for {@link TokenType#SYMBOL} only
 * @param value    The normalized text: identifiers lower-cased, strings single-quoted
 * @param position Offset of the first character in the source
 * @param end      Offset just past the last character in the source
 */
public record Token(TokenType type, SyntaxToken symbol, String value, int position, int end) {

    public enum TokenType {
        IDENTIFIER, // alpha, a1
        STRING_LITERAL, // 'Smith'
        NUMBER_LITERAL, // 42, -3.5
        SYMBOL, // any configured literal: \project, _{, ;, and
        EOF,
    }

    public boolean is(SyntaxToken token) {
        return type == TokenType.SYMBOL && symbol == token;
    }

    /**
     * True when {@code next} starts exactly where this token ends.
     */
    public boolean isAdjacentTo(Token next) {
        return end == next.position;
    }

    @Override
    public String toString() {
        String kind = type == TokenType.SYMBOL ? symbol.name() : type.name();
        return kind + (value != null ? "(" + value + ")" : "") + "@" + position;
    }
}
