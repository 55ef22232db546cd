package org.rapt.engine.plan;

import java.util.Objects;

/**
 * An attribute of a relation.
 *
 * @param relation The owning relation, or null for the result of a set operation
 * @param name     The attribute name
 */
public record Attribute(String relation, String name) {

    public Attribute {
        Objects.requireNonNull(name, "Attribute name cannot be null");
    }

    /**
     * The name qualified by its relation, e.g. {@code alpha.a1}.
     */
    public String prefixed() {
        return relation == null ? name : relation + "." + name;
    }

    public Attribute withRelation(String newRelation) {
        return new Attribute(newRelation, name);
    }

    public Attribute withName(String newName) {
        return new Attribute(relation, newName);
    }

    @Override
    public String toString() {
        return prefixed();
    }
}
