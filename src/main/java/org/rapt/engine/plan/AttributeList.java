package org.rapt.engine.plan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, ordered list of the attributes exposed by a node. Every operation returns a new list.
 * Order is significant: it fixes SQL column positions and display order.
 */
public final class AttributeList implements Iterable<Attribute> {

    private static final AttributeList EMPTY = new AttributeList(List.of());

    private final List<Attribute> attributes;

    private AttributeList(List<Attribute> attributes) {
        this.attributes = List.copyOf(attributes);
    }

    public static AttributeList empty() {
        return EMPTY;
    }

    public static AttributeList of(List<Attribute> attributes) {
        return new AttributeList(attributes);
    }

    /**
     * All names qualified by the same relation.
     */
    public static AttributeList of(String relation, List<String> names) {
        return new AttributeList(names.stream().map(n -> new Attribute(relation, n)).collect(Collectors.toList()));
    }

    public static AttributeList unqualified(List<String> names) {
        return of(null, names);
    }

    /**
     * Concatenation of both sides; every attribute keeps the relation it came from.
     */
    public static AttributeList merge(AttributeList left, AttributeList right) {
        List<Attribute> merged = new ArrayList<>(left.attributes);
        merged.addAll(right.attributes);
        return new AttributeList(merged);
    }

    /**
     * Keeps only the referenced attributes, in the order they are requested.
     *
     * @throws AttributeReferenceException if a reference is unknown or ambiguous
     */
    public AttributeList trim(List<String> references) {
        List<Attribute> kept = new ArrayList<>(references.size());
        for (String reference : references) {
            kept.add(resolve(reference));
        }
        return new AttributeList(kept);
    }

    /**
     * Moves every attribute to {@code relation}, replacing the names positionally when {@code names} is not empty.
     *
     * @throws InputException if {@code names} is non-empty and its size differs from this list's
     */
    public AttributeList rename(List<String> names, String relation) {
        if (!names.isEmpty() && names.size() != attributes.size()) {
            throw new InputException("Expected " + attributes.size() + " attribute names, got " + names.size()
                    + ": " + String.join(", ", names));
        }
        List<Attribute> renamed = new ArrayList<>(attributes.size());
        for (int i = 0; i < attributes.size(); i++) {
            Attribute attribute = attributes.get(i).withRelation(relation);
            renamed.add(names.isEmpty() ? attribute : attribute.withName(names.get(i)));
        }
        return new AttributeList(renamed);
    }

    /**
     * Drops attributes whose unqualified name is in {@code names}.
     */
    public AttributeList without(Collection<String> names) {
        Set<String> excluded = Set.copyOf(names);
        return new AttributeList(attributes.stream()
                .filter(a -> !excluded.contains(a.name()))
                .collect(Collectors.toList()));
    }

    /**
     * @throws AttributeReferenceException if any reference does not resolve to exactly one attribute
     */
    public void validate(Collection<String> references) {
        for (String reference : references) {
            resolve(reference);
        }
    }

    /**
     * Resolves a reference. An unqualified name must be unique across all attributes; a qualified
     * one must match both relation and name.
     */
    public Attribute resolve(String reference) {
        AttributeReference parsed = AttributeReference.parse(reference)
                .orElseThrow(() -> new AttributeReferenceException("Invalid attribute reference '" + reference + "'."));
        List<Attribute> matches = attributes.stream().filter(parsed::matches).collect(Collectors.toList());
        if (matches.isEmpty()) {
            throw new AttributeReferenceException("Attribute reference '" + parsed + "' does not exist in ("
                    + this + ").");
        }
        if (matches.size() > 1) {
            throw new AttributeReferenceException("Attribute reference '" + parsed + "' is ambiguous in ("
                    + this + ").");
        }
        return matches.get(0);
    }

    /**
     * Position of the attribute a reference resolves to.
     *
     * @throws AttributeReferenceException if the reference is unknown or ambiguous
     */
    public int indexOf(String reference) {
        return attributes.indexOf(resolve(reference));
    }

    public boolean contains(String reference) {
        return AttributeReference.parse(reference)
                .map(parsed -> attributes.stream().filter(parsed::matches).count() == 1)
                .orElse(false);
    }

    /**
     * Unqualified names.
     */
    public List<String> names() {
        return attributes.stream().map(Attribute::name).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Relation-qualified names, e.g. {@code beta.b1}.
     */
    public List<String> prefixedNames() {
        return attributes.stream().map(Attribute::prefixed).collect(Collectors.toUnmodifiableList());
    }

    public List<Attribute> asList() {
        return attributes;
    }

    public Attribute get(int index) {
        return attributes.get(index);
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    @Override
    public Iterator<Attribute> iterator() {
        return attributes.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AttributeList other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    /**
     * Comma separated qualified names, as used in a SELECT clause.
     */
    @Override
    public String toString() {
        return String.join(", ", prefixedNames());
    }
}
