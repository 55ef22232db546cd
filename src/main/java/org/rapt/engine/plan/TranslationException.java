package org.rapt.engine.plan;

/**
 * A node that a translator cannot express in its target language.
 */
public class TranslationException extends RaptException {

    public TranslationException(String message) {
        super(message);
    }

    @Override
    public boolean isUserError() {
        return false;
    }
}
