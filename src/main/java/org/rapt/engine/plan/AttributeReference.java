package org.rapt.engine.plan;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A possibly relation-qualified reference to an attribute, as written in an expression.
 *
 * @param relation The qualifying relation, or null
 * @param name     The attribute name
 */
public record AttributeReference(String relation, String name) {

    private static final Pattern REFERENCE =
            Pattern.compile("([A-Za-z][A-Za-z0-9_]*)(?:\\.([A-Za-z][A-Za-z0-9_]*))?");

    /**
     * Parses {@code attr} or {@code relation.attr}; anything else, including literals, is empty.
     */
    public static Optional<AttributeReference> parse(String text) {
        Matcher matcher = REFERENCE.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String first = matcher.group(1).toLowerCase(Locale.ROOT);
        if (matcher.group(2) == null) {
            return Optional.of(new AttributeReference(null, first));
        }
        return Optional.of(new AttributeReference(first, matcher.group(2).toLowerCase(Locale.ROOT)));
    }

    public boolean matches(Attribute attribute) {
        if (!name.equals(attribute.name())) {
            return false;
        }
        return relation == null || relation.equals(attribute.relation());
    }

    @Override
    public String toString() {
        return relation == null ? name : relation + "." + name;
    }
}
