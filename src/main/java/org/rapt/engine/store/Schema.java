package org.rapt.engine.store;

import org.rapt.engine.plan.RelationReferenceException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of relations and their ordered attribute names for one compilation pass.
 * Seeded by the caller and extended by definitions and assignments. Names are stored lower-cased.
 * Not thread-safe: a schema belongs to a single batch.
 */
public final class Schema {

    private final Map<String, List<String>> relations = new LinkedHashMap<>();

    public Schema() {
    }

    public Schema(Map<String, ? extends List<String>> relations) {
        Objects.requireNonNull(relations, "Relations cannot be null");
        relations.forEach(this::add);
    }

    public boolean contains(String name) {
        return name != null && relations.containsKey(normalize(name));
    }

    /**
     * @return a copy of the relation's attribute names
     * @throws RelationReferenceException if the relation is not defined
     */
    public List<String> getAttributes(String name) {
        List<String> attributes = name == null ? null : relations.get(normalize(name));
        if (attributes == null) {
            throw new RelationReferenceException("Relation '" + name + "' is not defined.");
        }
        return List.copyOf(attributes);
    }

    /**
     * @throws RelationReferenceException if the relation already exists
     */
    public void add(String name, List<String> attributes) {
        Objects.requireNonNull(name, "Relation name cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
        String key = normalize(name);
        if (relations.containsKey(key)) {
            throw new RelationReferenceException("Duplicate relation name '" + key + "'.");
        }
        relations.put(key, attributes.stream().map(Schema::normalize).collect(Collectors.toUnmodifiableList()));
    }

    public Set<String> relationNames() {
        return Set.copyOf(relations.keySet());
    }

    public Map<String, List<String>> toMap() {
        return new LinkedHashMap<>(relations);
    }

    @Override
    public String toString() {
        return "Schema" + relations;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
