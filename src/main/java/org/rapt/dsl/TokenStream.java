package org.rapt.dsl;

import org.rapt.dsl.Token.TokenType;

import java.util.List;

/**
 * Cursor over a token list shared by the statement and condition parsers.
 */
final class TokenStream {

    private final String source;
    private final List<Token> tokens;
    private int position;

    TokenStream(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
        this.position = 0;
    }

    Token peek() {
        return tokens.get(position);
    }

    Token peekAt(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    boolean check(SyntaxToken symbol) {
        return peek().is(symbol);
    }

    boolean check(TokenType type) {
        return peek().type() == type;
    }

    boolean isAtEnd() {
        return check(TokenType.EOF);
    }

    Token advance() {
        Token token = peek();
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    Token consume(SyntaxToken symbol, String message) {
        if (check(symbol)) {
            return advance();
        }
        throw error(message);
    }

    /**
     * Consumes {@code symbol}, which must start exactly where {@code previous} ends.
     */
    Token consumeAdjacent(SyntaxToken symbol, Token previous, String message) {
        Token token = consume(symbol, message);
        if (!previous.isAdjacentTo(token)) {
            throw new RaParseException(message + ": no whitespace allowed after '" + previous.value() + "'",
                    source, token.position());
        }
        return token;
    }

    RaParseException errorAt(String message, int offset) {
        return new RaParseException(message, source, offset);
    }

    RaParseException error(String message) {
        Token token = peek();
        String found = token.type() == TokenType.EOF ? "end of input" : "'" + token.value() + "'";
        return new RaParseException(message + ", got " + found, source, token.position());
    }
}
