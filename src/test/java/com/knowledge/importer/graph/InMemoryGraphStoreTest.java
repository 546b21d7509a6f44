package com.knowledge.importer.graph;

import com.knowledge.importer.model.GraphNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryGraphStore Tests")
class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("Node ids are assigned in creation order")
        void assignsSequentialIds() {
            GraphNode first = store.createNode("Person", Map.of("name", "Jon"));
            GraphNode second = store.createNode("Person", Map.of("name", "Ann"));

            assertEquals("0", first.nodeId());
            assertEquals("1", second.nodeId());
            assertEquals(2, store.nodeCount());
        }

        @Test
        @DisplayName("Embedding is kept out of the node properties")
        void embeddingStoredSeparately() {
            GraphNode node = store.createNode("Person",
                    Map.of("name", "Jon", GraphStore.EMBEDDING_PROPERTY, new float[]{1f, 0f}));

            assertFalse(node.properties().containsKey(GraphStore.EMBEDDING_PROPERTY));
            assertArrayEquals(new float[]{1f, 0f}, store.embeddingOf(node.nodeId()).orElseThrow());
        }

        @Test
        @DisplayName("Unsafe label is rejected")
        void rejectsUnsafeLabel() {
            assertThrows(IllegalArgumentException.class,
                    () -> store.createNode("Person) DELETE n", Map.of("name", "x")));
            assertEquals(0, store.nodeCount());
        }

        @Test
        @DisplayName("Update merges properties and null removes one")
        void updateMergesProperties() {
            GraphNode node = store.createNode("Person", Map.of("name", "Jon", "nickname", "JJ"));
            Map<String, Object> changes = new HashMap<>();
            changes.put("email", "jon@example.com");
            changes.put("nickname", null);

            GraphNode updated = store.updateNode(node.nodeId(), changes);

            assertEquals(Map.of("name", "Jon", "email", "jon@example.com"), updated.properties());
        }

        @Test
        @DisplayName("Updating an unknown node fails")
        void updateUnknownNodeFails() {
            assertThrows(IllegalStateException.class, () -> store.updateNode("42", Map.of("a", 1)));
        }
    }

    @Nested
    @DisplayName("Relationships")
    class Relationships {

        @Test
        @DisplayName("Created edge is visible and keeps non-null properties")
        void createsRelationship() {
            String jon = store.createNode("Person", Map.of("name", "Jon")).nodeId();
            String acme = store.createNode("Organization", Map.of("name", "Acme")).nodeId();
            Map<String, Object> props = new HashMap<>();
            props.put("since", 2020);
            props.put("role", null);

            assertTrue(store.createRelationship(jon, "WORKS_AT", acme, props));

            assertTrue(store.relationshipExists(jon, "WORKS_AT", acme));
            assertFalse(store.relationshipExists(acme, "WORKS_AT", jon));
            assertEquals(Map.of("since", 2020), store.relationshipProperties(jon, "WORKS_AT", acme).orElseThrow());
            assertEquals(1, store.relationshipCount());
        }

        @Test
        @DisplayName("A second write of the same edge keeps the first")
        void keepsFirstEdge() {
            String jon = store.createNode("Person", Map.of("name", "Jon")).nodeId();
            String acme = store.createNode("Organization", Map.of("name", "Acme")).nodeId();
            store.createRelationship(jon, "WORKS_AT", acme, Map.of("since", 2020));

            assertFalse(store.createRelationship(jon, "WORKS_AT", acme, Map.of("since", 2024)));

            assertEquals(Map.of("since", 2020), store.relationshipProperties(jon, "WORKS_AT", acme).orElseThrow());
            assertEquals(1, store.relationshipCount());
        }

        @Test
        @DisplayName("Both endpoints must exist")
        void requiresEndpoints() {
            String jon = store.createNode("Person", Map.of("name", "Jon")).nodeId();

            assertThrows(IllegalStateException.class,
                    () -> store.createRelationship(jon, "WORKS_AT", "99", Map.of()));
        }

        @Test
        @DisplayName("Type must be upper-case identifier")
        void validatesType() {
            String jon = store.createNode("Person", Map.of("name", "Jon")).nodeId();

            assertThrows(IllegalArgumentException.class,
                    () -> store.createRelationship(jon, "knows", jon, Map.of()));
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("Property lookup compares numbers by value")
        void findByPropertyComparesNumbers() {
            store.createNode("Asset", Map.of("name", "truck", "year", 2019L));

            assertTrue(store.findByProperty("Asset", "year", 2019).isPresent());
            assertTrue(store.findByProperty("Person", "year", 2019).isEmpty());
        }

        @Test
        @DisplayName("Multi-property lookup needs every entry to match")
        void findByPropertiesMatchesAll() {
            store.createNode("Person", Map.of("first_name", "Jon", "last_name", "Smith"));

            assertTrue(store.findByProperties("Person", Map.of("first_name", "Jon", "last_name", "Smith")).isPresent());
            assertTrue(store.findByProperties("Person", Map.of("first_name", "Jon", "last_name", "Doe")).isEmpty());
            assertTrue(store.findByProperties("Person", Map.of()).isEmpty());
        }

        @Test
        @DisplayName("Containing lookup is case-insensitive and prefers sparse nodes")
        void findByPropertyContainingPrefersSparseNodes() {
            store.createNode("Asset", Map.of("name", "Toyota Tacoma 2020", "brand", "Toyota", "year", 2020));
            GraphNode sparse = store.createNode("Asset", Map.of("name", "tacoma"));

            assertEquals(sparse.nodeId(), store.findByPropertyContaining("Asset", "TACOMA").orElseThrow().nodeId());
            assertEquals(sparse.nodeId(), store.findByPropertyContaining(null, "tacoma").orElseThrow().nodeId());
            assertTrue(store.findByPropertyContaining("Person", "tacoma").isEmpty());
        }

        @Test
        @DisplayName("Label listing honours the limit and creation order")
        void findByLabelHonoursLimit() {
            store.createNode("Person", Map.of("name", "a"));
            store.createNode("Person", Map.of("name", "b"));
            store.createNode("Person", Map.of("name", "c"));

            List<GraphNode> nodes = store.findByLabel("Person", 2);

            assertEquals(List.of("a", "b"), nodes.stream().map(GraphNode::name).toList());
        }

        @Test
        @DisplayName("Vector query ranks nodes by cosine similarity")
        void vectorQueryRanksBySimilarity() {
            store.createNode("Person", Map.of("name", "far", "embedding", new float[]{0f, 1f}));
            store.createNode("Person", Map.of("name", "near", "embedding", List.of(1.0, 0.1)));
            store.createNode("Person", Map.of("name", "none"));

            List<ScoredNode> hits = store.vectorQuery("Person", new float[]{1f, 0f}, 5);

            assertEquals(2, hits.size());
            assertEquals("near", hits.get(0).node().name());
            assertTrue(hits.get(0).similarity() > hits.get(1).similarity());
        }
    }
}
