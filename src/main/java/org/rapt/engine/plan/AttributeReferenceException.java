package org.rapt.engine.plan;

/**
 * An attribute reference that does not resolve to exactly one attribute.
 */
public class AttributeReferenceException extends RaptException {

    public AttributeReferenceException(String message) {
        super(message);
    }
}
