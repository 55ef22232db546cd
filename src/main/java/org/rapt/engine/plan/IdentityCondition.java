package org.rapt.engine.plan;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A leaf operand: an attribute reference, a quoted string or a number.
 */
public record IdentityCondition(String text) implements Condition {

    public IdentityCondition {
        Objects.requireNonNull(text, "Text cannot be null");
    }

    public boolean isAttributeReference() {
        return AttributeReference.parse(text).isPresent();
    }

    @Override
    public String toSql(UnaryOperator<String> references) {
        return isAttributeReference() ? references.apply(text) : text;
    }

    @Override
    public String toLatex() {
        return text;
    }

    @Override
    public List<String> attributeReferences() {
        return isAttributeReference() ? List.of(text) : List.of();
    }

    @Override
    public String toString() {
        return text;
    }
}
