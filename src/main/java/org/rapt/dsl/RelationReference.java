package org.rapt.dsl;

import java.util.Objects;

public record RelationReference(String name) implements RaExpression {

    public RelationReference {
        Objects.requireNonNull(name, "Name cannot be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
