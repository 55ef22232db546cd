package org.rapt.engine.plan;

/**
 * Unknown relation, duplicate relation name, or an ambiguous relation reference.
 */
public class RelationReferenceException extends RaptException {

    public RelationReferenceException(String message) {
        super(message);
    }
}
