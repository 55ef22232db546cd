package org.rapt.dsl;

import org.rapt.engine.plan.RaptException;

/**
 * Syntax error: the grammar could not consume a full statement.
 */
public class RaParseException extends RaptException {

    private final int position;
    private final int line;
    private final int column;

    public RaParseException(String message) {
        super(message);
        this.position = -1;
        this.line = -1;
        this.column = -1;
    }

    public RaParseException(String message, String source, int position) {
        super("line " + lineOf(source, position) + ":" + columnOf(source, position) + " " + message);
        this.position = position;
        this.line = lineOf(source, position);
        this.column = columnOf(source, position);
    }

    public int getPosition() {
        return position;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return position >= 0;
    }

    private static int lineOf(String source, int position) {
        int line = 1;
        for (int i = 0; i < Math.min(position, source.length()); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String source, int position) {
        int bounded = Math.min(position, source.length());
        int lineStart = source.lastIndexOf('\n', bounded - 1) + 1;
        return bounded - lineStart + 1;
    }
}
