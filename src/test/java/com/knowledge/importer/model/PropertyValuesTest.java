package com.knowledge.importer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertyValues Tests")
class PropertyValuesTest {

    @Test
    @DisplayName("Numbers compare by value across boxed types")
    void numbersCompareByValue() {
        assertTrue(PropertyValues.equal(42L, 42));
        assertTrue(PropertyValues.equal(List.of(1L, 2L), List.of(1, 2)));
        assertFalse(PropertyValues.equal(1.5, 1));
    }

    @Test
    @DisplayName("Changes skip nulls, the id and the embedding")
    void changesSkipUncomparedKeys() {
        Map<String, Object> stored = Map.of("name", "Jon", "age", 40L);
        Map<String, Object> candidate = new HashMap<>();
        candidate.put("id", "p-1");
        candidate.put("embedding", List.of(0.1, 0.2));
        candidate.put("name", "Jon");
        candidate.put("age", 41);
        candidate.put("nickname", null);

        assertEquals(Map.of("age", 41), PropertyValues.changes(stored, candidate));
    }

    @Test
    @DisplayName("sameAs needs at least one compared value")
    void sameAsNeedsAComparison() {
        assertTrue(PropertyValues.sameAs(Map.of("name", "Jon", "age", 40L), Map.of("name", "Jon", "age", 40)));
        assertFalse(PropertyValues.sameAs(Map.of("name", "Jon"), Map.of("id", "p-1")));
        assertFalse(PropertyValues.sameAs(Map.of("name", "Jon"), Map.of("name", "Jonathan")));
    }
}
