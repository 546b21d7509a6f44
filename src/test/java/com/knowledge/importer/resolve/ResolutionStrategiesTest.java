package com.knowledge.importer.resolve;

import com.knowledge.importer.embedding.EmbeddingGateway;
import com.knowledge.importer.graph.InMemoryGraphStore;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.review.ConfidenceScorer;
import com.knowledge.importer.review.ReviewItem;
import com.knowledge.importer.vector.SimilaritySearch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Resolution strategy Tests")
class ResolutionStrategiesTest {

    private InMemoryGraphStore store;
    private NodeMatcherRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        registry = new NodeMatcherRegistry();
    }

    private static ResolutionContext.Builder person(Map<String, Object> properties) {
        return ResolutionContext.builder().type("Person").properties(properties);
    }

    @Nested
    @DisplayName("ConstraintStrategy")
    class Constraint {

        @Test
        @DisplayName("Finds the node carrying the same id")
        void matchesOnId() {
            GraphNode stored = store.createNode("Person", Map.of("id", "p-1", "name", "Jon"));
            ConstraintStrategy strategy = new ConstraintStrategy(store);

            Optional<GraphNode> found = strategy.resolve(person(Map.of("id", "p-1", "name", "Someone Else")).build());

            assertEquals(Optional.of(stored.nodeId()), found.map(GraphNode::nodeId));
        }

        @Test
        @DisplayName("Does not cross types on id")
        void idIsScopedToType() {
            store.createNode("Asset", Map.of("id", "p-1"));
            ConstraintStrategy strategy = new ConstraintStrategy(store);

            assertTrue(strategy.resolve(person(Map.of("id", "p-1")).build()).isEmpty());
        }

        @Test
        @DisplayName("Falls back to the declared unique properties")
        void matchesOnUniqueProperties() {
            GraphNode stored = store.createNode("Person", Map.of("name", "Jon", "badge", "B-7"));
            ConstraintStrategy strategy = new ConstraintStrategy(store);

            ResolutionContext context = person(Map.of("id", "other", "badge", "B-7", "name", "J"))
                    .uniqueProperties(Set.of("badge"))
                    .build();

            assertEquals(Optional.of(stored.nodeId()), strategy.resolve(context).map(GraphNode::nodeId));
        }

        @Test
        @DisplayName("Unique properties absent from the candidate are ignored")
        void missingUniquePropertiesIgnored() {
            store.createNode("Person", Map.of("name", "Jon"));
            ConstraintStrategy strategy = new ConstraintStrategy(store);

            ResolutionContext context = person(Map.of("name", "Jon"))
                    .uniqueProperties(Set.of("badge"))
                    .build();

            assertTrue(strategy.resolve(context).isEmpty());
        }
    }

    @Nested
    @DisplayName("VectorStrategy")
    @ExtendWith(MockitoExtension.class)
    class Vector {

        @Mock
        private EmbeddingGateway gateway;

        @Mock
        private MetricsService metrics;

        private VectorStrategy strategy() {
            return new VectorStrategy(new SimilaritySearch(store), gateway, registry, metrics);
        }

        @Test
        @DisplayName("Uses the embedding the candidate carries")
        void carriedEmbedding() {
            GraphNode stored = store.createNode("Person",
                    Map.of("name", "Jon", "embedding", new float[]{1f, 0f, 0f}));
            float[] carried = {0.9f, 0.1f, 0f};

            ResolutionContext context = person(Map.of("name", "Jonny", "embedding", carried)).build();
            Optional<GraphNode> found = strategy().resolve(context);

            assertEquals(Optional.of(stored.nodeId()), found.map(GraphNode::nodeId));
            assertSame(carried, context.embedding());
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("Embeds the candidate text when no vector is carried")
        void embedsCandidateText() {
            store.createNode("Person", Map.of("name", "Jon", "embedding", new float[]{0f, 1f}));
            float[] derived = {1f, 0f};
            when(gateway.embed(anyString())).thenReturn(Optional.of(derived));

            ResolutionContext context = person(Map.of("name", "Jon Smith", "email", "jon@example.com")).build();
            Optional<GraphNode> found = strategy().resolve(context);

            assertTrue(found.isEmpty(), "orthogonal vectors are below the threshold");
            assertArrayEquals(derived, context.embedding());
            verify(gateway).embed("Jon Smith. jon@example.com");
        }

        @Test
        @DisplayName("Respects the per-run threshold")
        void thresholdApplied() {
            store.createNode("Person", Map.of("name", "Jon", "embedding", new float[]{1f, 1f}));
            float[] carried = {1f, 0f};

            ResolutionContext strict = person(Map.of("embedding", carried)).vectorThreshold(0.8).build();
            ResolutionContext loose = person(Map.of("embedding", carried)).vectorThreshold(0.7).build();

            assertTrue(strategy().resolve(strict).isEmpty());
            assertTrue(strategy().resolve(loose).isPresent());
        }

        @Test
        @DisplayName("A higher threshold never merges more of the same candidates")
        void thresholdMonotonic() {
            store.createNode("Person", Map.of("name", "Jon", "embedding", new float[]{1f, 0f}));
            store.createNode("Person", Map.of("name", "Ann", "embedding", new float[]{0f, 1f}));
            List<float[]> candidates = List.of(
                    new float[]{1f, 0.1f}, new float[]{1f, 1f}, new float[]{0.2f, 1f},
                    new float[]{-1f, 0.5f}, new float[]{1f, -1f});

            long previous = Long.MAX_VALUE;
            for (int step = 1; step <= 10; step++) {
                double threshold = step / 10.0;
                long merged = candidates.stream()
                        .filter(vector -> strategy().resolve(person(Map.of("embedding", vector))
                                .vectorThreshold(threshold).build()).isPresent())
                        .count();
                assertTrue(merged <= previous, "threshold " + threshold + " merged " + merged);
                previous = merged;
            }
            assertEquals(0, previous);
        }

        @Test
        @DisplayName("An unavailable embedding is counted and skipped")
        void embeddingFailure() {
            when(gateway.embed(anyString())).thenReturn(Optional.empty());
            when(gateway.getModel()).thenReturn("test-model");

            ResolutionContext context = person(Map.of("name", "Jon")).build();

            assertTrue(strategy().resolve(context).isEmpty());
            assertNull(context.embedding());
            verify(metrics).incrementEmbeddingFailure();
        }

        @Test
        @DisplayName("Disabled vector search does nothing")
        void disabled() {
            ResolutionContext context = person(Map.of("name", "Jon")).vectorSearchEnabled(false).build();

            assertTrue(strategy().resolve(context).isEmpty());
            verifyNoInteractions(gateway, metrics);
        }
    }

    @Nested
    @DisplayName("FuzzyStrategy")
    @ExtendWith(MockitoExtension.class)
    class Fuzzy {

        @Mock
        private MetricsService metrics;

        private FuzzyStrategy strategy() {
            return new FuzzyStrategy(store, registry, new ConfidenceScorer(registry), metrics);
        }

        @Test
        @DisplayName("A medium-confidence pair becomes a pending review, not a match")
        void mediumConfidenceQueuesReview() {
            GraphNode stored = store.createNode("Person", Map.of("first_name", "Jon", "last_name", "Smith"));

            ResolutionContext context = person(Map.of("first_name", "Jonathan", "last_name", "Smith",
                    "embedding", List.of(0.1, 0.2))).build();
            Optional<GraphNode> found = strategy().resolve(context);

            assertTrue(found.isEmpty());
            List<ReviewItem> reviews = context.pendingReviews();
            assertEquals(1, reviews.size());
            ReviewItem review = reviews.get(0);
            assertNotNull(review.getId());
            assertEquals(stored.nodeId(), review.getExistingNodeId());
            assertEquals("Person", review.getEntityType());
            assertEquals(0.7, review.getConfidenceScore(), 1e-9);
            assertEquals(List.of("last_name_first_initial_match"), review.getMatchedMethods());
            assertFalse(review.getCandidateProperties().containsKey("embedding"));
            verify(metrics).recordMatchConfidence(0.7);
            verify(metrics).incrementMatchDecision("human_review");
        }

        @Test
        @DisplayName("Without human review the matcher decides alone")
        void matcherDecidesWithoutReview() {
            GraphNode stored = store.createNode("Person", Map.of("first_name", "Jon", "last_name", "Smith"));

            ResolutionContext context = person(Map.of("first_name", "Jonathan", "last_name", "Smith"))
                    .humanReviewEnabled(false)
                    .build();

            assertEquals(Optional.of(stored.nodeId()), strategy().resolve(context).map(GraphNode::nodeId));
            assertTrue(context.pendingReviews().isEmpty());
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("A shared email merges outright")
        void sharedEmailMerges() {
            store.createNode("Person", Map.of("name", "Unrelated"));
            GraphNode stored = store.createNode("Person", Map.of("name", "Jon Smith", "email", "jon@example.com"));

            ResolutionContext context = person(Map.of("name", "J. Smith", "email", "JON@example.com")).build();

            assertEquals(Optional.of(stored.nodeId()), strategy().resolve(context).map(GraphNode::nodeId));
            assertTrue(context.pendingReviews().isEmpty());
        }

        @Test
        @DisplayName("Low-confidence pairs are passed over")
        void lowConfidenceRejected() {
            store.createNode("Vehicle", Map.of("name", "truck", "brand", "Ford"));

            ResolutionContext context = ResolutionContext.builder()
                    .type("Vehicle")
                    .properties(Map.of("name", "truck", "brand", "Chevy"))
                    .build();

            assertTrue(strategy().resolve(context).isEmpty());
            assertTrue(context.pendingReviews().isEmpty());
            verify(metrics).incrementMatchDecision("auto_reject");
        }

        @Test
        @DisplayName("Only the first fuzzyCandidateLimit stored nodes are compared")
        void candidateLimit() {
            store.createNode("Person", Map.of("name", "Someone"));
            store.createNode("Person", Map.of("name", "Jon Smith", "email", "jon@example.com"));

            ResolutionContext context = person(Map.of("email", "jon@example.com"))
                    .fuzzyCandidateLimit(1)
                    .build();

            assertTrue(strategy().resolve(context).isEmpty());
        }
    }

    @Nested
    @DisplayName("PropertyStrategy")
    class Property {

        @Test
        @DisplayName("Matches a node holding every non-empty candidate property")
        void exactProperties() {
            GraphNode stored = store.createNode("Person", Map.of("name", "Jon", "city", "Tacoma", "age", 40));
            PropertyStrategy strategy = new PropertyStrategy(store);

            ResolutionContext context = person(Map.of("name", "Jon", "city", "Tacoma", "id", "new-id",
                    "nickname", "  ")).build();

            assertEquals(Optional.of(stored.nodeId()), strategy.resolve(context).map(GraphNode::nodeId));
        }

        @Test
        @DisplayName("Any differing property prevents the match")
        void differingProperty() {
            store.createNode("Person", Map.of("name", "Jon", "city", "Tacoma"));
            PropertyStrategy strategy = new PropertyStrategy(store);

            assertTrue(strategy.resolve(person(Map.of("name", "Jon", "city", "Seattle")).build()).isEmpty());
        }

        @Test
        @DisplayName("Nothing to compare yields no match")
        void nothingToCompare() {
            store.createNode("Person", Map.of("name", "Jon"));
            PropertyStrategy strategy = new PropertyStrategy(store);

            assertTrue(strategy.resolve(person(Map.of("id", "p-1")).build()).isEmpty());
        }
    }
}
