package org.rapt.dsl;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A dependency declaration: keyword, attribute names and one target, or two for inclusion dependencies.
 */
public record DependencyStatement(SyntaxToken kind, List<String> attributes, List<DependencyTarget> targets)
        implements Statement {

    public DependencyStatement {
        Objects.requireNonNull(kind, "Kind cannot be null");
        attributes = List.copyOf(attributes);
        targets = List.copyOf(targets);
    }

    @Override
    public String toString() {
        String renderedTargets = targets.size() == 1
                ? targets.get(0).toString()
                : targets.stream().map(DependencyTarget::toString).collect(Collectors.joining(", ", "(", ")"));
        return kind + "[" + String.join(", ", attributes) + "] " + renderedTargets;
    }
}
