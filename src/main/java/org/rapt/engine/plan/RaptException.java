package org.rapt.engine.plan;

/**
 * Root of every error raised while compiling relational algebra.
 */
public abstract class RaptException extends RuntimeException {

    protected RaptException(String message) {
        super(message);
    }

    protected RaptException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True when the error was caused by malformed input rather than by an incomplete translator.
     */
    public boolean isUserError() {
        return true;
    }
}
