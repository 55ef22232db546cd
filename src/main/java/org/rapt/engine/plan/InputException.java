package org.rapt.engine.plan;

/**
 * Well-formed input that violates a relational algebra rule, such as a set operation
 * over incompatible relations.
 */
public class InputException extends RaptException {

    public InputException(String message) {
        super(message);
    }
}
