package org.rapt.engine.store;

import org.rapt.engine.plan.RelationReferenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaTest {

    @Test
    @DisplayName("Relation names are case-insensitive")
    void testCaseNormalization() {
        Schema schema = new Schema(Map.of("Alpha", List.of("A1", "a2")));

        assertTrue(schema.contains("alpha"));
        assertTrue(schema.contains("ALPHA"));
        assertEquals(List.of("a1", "a2"), schema.getAttributes("aLpHa"));
        assertFalse(schema.contains(null));
    }

    @Test
    @DisplayName("Adding a duplicate relation fails")
    void testDuplicate() {
        Schema schema = new Schema();
        schema.add("alpha", List.of("a1"));

        assertThrows(RelationReferenceException.class, () -> schema.add("ALPHA", List.of("x")));
    }

    @Test
    @DisplayName("Unknown relations fail")
    void testUnknown() {
        assertThrows(RelationReferenceException.class, () -> new Schema().getAttributes("alpha"));
    }

    @Test
    @DisplayName("Reads return copies")
    void testCopies() {
        List<String> attributes = new ArrayList<>(List.of("a1", "a2"));
        Schema schema = new Schema();
        schema.add("alpha", attributes);
        attributes.add("a3");

        assertEquals(List.of("a1", "a2"), schema.getAttributes("alpha"));
        Map<String, List<String>> copy = schema.toMap();
        copy.remove("alpha");
        assertTrue(schema.contains("alpha"));
        assertEquals(Set.of("alpha"), schema.relationNames());
    }
}
