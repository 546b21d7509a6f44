package com.knowledge.importer.review;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.InMemoryGraphStore;
import com.knowledge.importer.model.GraphNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReviewServiceTest {

    @Nested
    @DisplayName("Against an in-memory graph")
    class InMemory {

        private InMemoryGraphStore graphStore;
        private InMemoryReviewQueue reviewQueue;
        private ReviewService reviewService;
        private GraphNode existing;

        @BeforeEach
        void setUp() {
            graphStore = new InMemoryGraphStore();
            reviewQueue = new InMemoryReviewQueue();
            reviewService = new ReviewService(reviewQueue, graphStore);
            existing = graphStore.createNode("Person", Map.of("name", "Jon Smith"));
        }

        private ReviewItem submit(Map<String, Object> candidate) {
            return reviewQueue.submit(ReviewItem.builder()
                    .entityType("Person")
                    .existingNodeId(existing.nodeId())
                    .existingProperties(existing.properties())
                    .candidateProperties(candidate)
                    .confidenceScore(0.7)
                    .build());
        }

        @Test
        @DisplayName("Approve folds the candidate properties into the stored node")
        void approveFoldsProperties() {
            ReviewItem item = submit(Map.of("name", "Jon Smith", "email", "jon@example.com"));

            ReviewOutcome outcome = reviewService.approve(item.getId(), "reviewer-1", "Same person");

            assertEquals(ReviewStatus.APPROVED, outcome.status());
            assertEquals(existing.nodeId(), outcome.appliedNodeId());
            assertEquals("reviewer-1", outcome.reviewerId());
            assertEquals("jon@example.com",
                    graphStore.findByNodeId(existing.nodeId()).orElseThrow().property("email"));
            assertEquals(0, reviewService.countPending());
        }

        @Test
        @DisplayName("Approve can point at another node")
        void approveIntoOtherNode() {
            GraphNode other = graphStore.createNode("Person", Map.of("name", "Jonathan Smith"));
            ReviewItem item = submit(Map.of("phone", "555-123-4567"));

            ReviewOutcome outcome = reviewService.approve(item.getId(), other.nodeId(), "reviewer-1", null);

            assertEquals(other.nodeId(), outcome.appliedNodeId());
            assertEquals("555-123-4567", graphStore.findByNodeId(other.nodeId()).orElseThrow().property("phone"));
            assertNull(graphStore.findByNodeId(existing.nodeId()).orElseThrow().property("phone"));
        }

        @Test
        @DisplayName("Reject leaves the graph untouched")
        void rejectLeavesGraph() {
            ReviewItem item = submit(Map.of("email", "other@example.com"));

            ReviewOutcome outcome = reviewService.reject(item.getId(), "reviewer-1", "Different people");

            assertEquals(ReviewStatus.REJECTED, outcome.status());
            assertNull(outcome.appliedNodeId());
            assertEquals(Map.of("name", "Jon Smith"),
                    graphStore.findByNodeId(existing.nodeId()).orElseThrow().properties());
        }

        @Test
        @DisplayName("Resolving twice returns the first outcome")
        void resolvingIsIdempotent() {
            ReviewItem item = submit(Map.of("email", "jon@example.com"));

            ReviewOutcome first = reviewService.reject(item.getId(), "reviewer-1", null);
            ReviewOutcome second = reviewService.approve(item.getId(), "reviewer-2", null);

            assertEquals(first, second);
            assertEquals(ReviewAction.REJECT, second.action());
            assertNull(graphStore.findByNodeId(existing.nodeId()).orElseThrow().property("email"));
        }

        @Test
        @DisplayName("Merge requires a target node")
        void mergeRequiresTarget() {
            ReviewItem item = submit(Map.of("email", "jon@example.com"));

            assertThrows(IllegalArgumentException.class,
                    () -> reviewService.merge(item.getId(), " ", "reviewer-1", null));
            assertThrows(IllegalArgumentException.class,
                    () -> reviewService.merge(item.getId(), "999", "reviewer-1", null));
            assertTrue(reviewService.get(item.getId()).isPending());
        }

        @Test
        @DisplayName("Unknown review id fails")
        void unknownReviewFails() {
            assertThrows(IllegalArgumentException.class,
                    () -> reviewService.approve("missing", "reviewer-1", null));
        }

        @Test
        @DisplayName("Score range bounds must be ordered")
        void scoreRangeValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> reviewService.pendingByScoreRange(0.8, 0.4, com.knowledge.importer.api.PageRequest.first(10)));
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Against a mocked graph")
    class Mocked {

        @Mock
        private GraphStore graphStore;

        private InMemoryReviewQueue reviewQueue;
        private ReviewService reviewService;

        @BeforeEach
        void setUp() {
            reviewQueue = new InMemoryReviewQueue();
            reviewService = new ReviewService(reviewQueue, graphStore);
        }

        @Test
        @DisplayName("Unchanged properties skip the update")
        void unchangedPropertiesSkipUpdate() {
            ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                    .entityType("Person")
                    .existingNodeId("7")
                    .candidateProperties(Map.of("name", "Jon"))
                    .confidenceScore(0.6)
                    .build());
            when(graphStore.findByNodeId("7"))
                    .thenReturn(Optional.of(new GraphNode("7", "Person", Map.of("name", "Jon"))));

            ReviewOutcome outcome = reviewService.merge(item.getId(), "7", "reviewer-1", null);

            assertEquals(ReviewAction.MERGE, outcome.action());
            assertEquals(ReviewStatus.APPROVED, outcome.status());
            verify(graphStore, never()).updateNode(anyString(), anyMap());
        }
    }
}
