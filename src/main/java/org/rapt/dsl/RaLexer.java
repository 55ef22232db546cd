package org.rapt.dsl;

import org.rapt.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for the relational algebra language.
 * Literals come from a {@link Syntax}, restricted to the tokens of a {@link Dialect},
 * and are matched longest first and case-insensitively.
 */
public final class RaLexer {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Pattern NUMBER = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+");

    private final String input;
    private final String paramsStart;
    private final List<Map.Entry<SyntaxToken, String>> literals;
    private int position;

    public RaLexer(String input) {
        this(input, Syntax.defaults(), Dialect.DEPENDENCY);
    }

    public RaLexer(String input, Syntax syntax, Dialect dialect) {
        this.input = input;
        this.paramsStart = syntax.literal(SyntaxToken.PARAMS_START);
        this.literals = new ArrayList<>();
        for (Map.Entry<SyntaxToken, String> entry : syntax.literals().entrySet()) {
            if (dialect.supports(entry.getKey())) {
                literals.add(Map.entry(entry.getKey(), entry.getValue()));
            }
        }
        literals.sort(Comparator.comparingInt((Map.Entry<SyntaxToken, String> e) -> e.getValue().length()).reversed());
        this.position = 0;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return List of tokens, terminated by an EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (position < input.length()) {
            skipWhitespace();
            if (position >= input.length())
                break;

            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, null, null, position, position));
        return tokens;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private Token nextToken() {
        char c = input.charAt(position);

        if (c == '\'' || c == '"') {
            return readStringLiteral(c);
        }

        if (startsNumber()) {
            return readMatch(NUMBER, TokenType.NUMBER_LITERAL);
        }

        Token symbol = readSymbol();
        if (symbol != null) {
            return symbol;
        }

        if (Character.isLetter(c)) {
            return readMatch(IDENTIFIER, TokenType.IDENTIFIER);
        }

        throw new RaParseException("Unexpected character '" + c + "'", input, position);
    }

    private Token readSymbol() {
        for (Map.Entry<SyntaxToken, String> entry : literals) {
            String literal = entry.getValue();
            if (input.regionMatches(true, position, literal, 0, literal.length())
                    && endsAtBoundary(literal, position + literal.length())) {
                int start = position;
                position += literal.length();
                return new Token(TokenType.SYMBOL, entry.getKey(), literal.toLowerCase(Locale.ROOT), start, position);
            }
        }
        return null;
    }

    /**
     * A literal ending in a word character must not run into an identifier, so {@code order} is never
     * {@code or} followed by {@code der}. Keyword literals such as {@code inc=} are only recognized in front
     * of a parameter block.
     */
    private boolean endsAtBoundary(String literal, int next) {
        if (input.startsWith(paramsStart, next)) {
            return true;
        }
        boolean wordLike = Character.isLetter(literal.charAt(0));
        boolean endsInWord = isWordChar(literal.charAt(literal.length() - 1));
        if (wordLike && !endsInWord) {
            return false;
        }
        return !endsInWord || next >= input.length() || !isWordChar(input.charAt(next));
    }

    private boolean startsNumber() {
        char c = input.charAt(position);
        if (Character.isDigit(c)) {
            return true;
        }
        if (c == '+' || c == '-') {
            return digitAt(position + 1) || (charAt(position + 1) == '.' && digitAt(position + 2));
        }
        // A dot directly after a word qualifies an attribute: alpha.a1
        return c == '.' && digitAt(position + 1) && (position == 0 || !isWordChar(input.charAt(position - 1)));
    }

    private Token readMatch(Pattern pattern, TokenType type) {
        Matcher matcher = pattern.matcher(input).region(position, input.length());
        if (!matcher.lookingAt()) {
            throw new RaParseException("Malformed " + type.name().toLowerCase(Locale.ROOT), input, position);
        }
        int start = position;
        position = matcher.end();
        String text = matcher.group();
        return new Token(type, null, type == TokenType.IDENTIFIER ? text.toLowerCase(Locale.ROOT) : text,
                start, position);
    }

    /**
     * Reads a quoted string; a doubled quote character stands for one quote, as in {@code 'it''s'}.
     * The value is always rendered single-quoted.
     */
    private Token readStringLiteral(char quote) {
        int start = position;
        StringBuilder content = new StringBuilder();
        int index = position + 1;
        while (true) {
            int close = input.indexOf(quote, index);
            if (close < 0) {
                throw new RaParseException("Unterminated string literal", input, start);
            }
            content.append(input, index, close);
            if (charAt(close + 1) != quote) {
                position = close + 1;
                break;
            }
            content.append(quote);
            index = close + 2;
        }
        return new Token(TokenType.STRING_LITERAL, null, "'" + content.toString().replace("'", "''") + "'",
                start, position);
    }

    private char charAt(int index) {
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private boolean digitAt(int index) {
        return Character.isDigit(charAt(index));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
