package com.knowledge.importer.api;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.InMemoryGraphStore;
import com.knowledge.importer.importer.ImportOptions;
import com.knowledge.importer.importer.ImportStatistics;
import com.knowledge.importer.matcher.DefaultNodeMatcher;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MicrometerMetricsService;
import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.model.ImportRequest;
import com.knowledge.importer.review.ReviewItem;
import com.knowledge.importer.review.ReviewOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("KnowledgeGraphImporter Tests")
class KnowledgeGraphImporterTest {

    @Test
    @DisplayName("Defaults to an in-memory store and the built-in matchers")
    void defaults() {
        try (KnowledgeGraphImporter importer = KnowledgeGraphImporter.builder().build()) {
            ImportStatistics stats = importer.importGraph(ImportRequest.ofEntities(List.of(
                    CandidateNode.of("Person", Map.of("name", "Jon Smith")))));

            assertEquals(1, stats.getNodesCreated());
            assertTrue(importer.graphStore() instanceof InMemoryGraphStore);
            assertEquals("person", importer.registry().matcherFor("Contact").getName());
        }
    }

    @Test
    @DisplayName("The configured similarity threshold reaches the default matcher")
    void globalThreshold() {
        try (KnowledgeGraphImporter importer = KnowledgeGraphImporter.builder()
                .options(ImportOptions.builder().similarityThreshold(0.65).build())
                .build()) {
            assertEquals(0.65, importer.registry().similarityThresholdFor("Widget"));
            assertEquals(DefaultNodeMatcher.DEFAULT_THRESHOLD, new NodeMatcherRegistry().similarityThresholdFor("Widget"));
        }
    }

    @Test
    @DisplayName("Per-call options override the defaults")
    void perCallOptions() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        try (KnowledgeGraphImporter importer = KnowledgeGraphImporter.builder()
                .metricsService(new MicrometerMetricsService(meters))
                .build()) {
            ImportStatistics stats = importer.importGraph(
                    ImportRequest.ofEntities(List.of(CandidateNode.of("Person", Map.of("name", "Jon")))),
                    ImportOptions.builder().dryRun(true).build());

            assertTrue(stats.isDryRun());
            assertEquals(0, ((InMemoryGraphStore) importer.graphStore()).nodeCount());
            assertNotNull(meters.find("kg.import.duration").tag("dryRun", "true").timer());
        }
    }

    @Test
    @DisplayName("Queued reviews can be approved through the review API")
    void reviewRoundTrip() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        GraphNode existing = store.createNode("Person", Map.of("first_name", "Jon", "last_name", "Smith"));

        try (KnowledgeGraphImporter importer = KnowledgeGraphImporter.builder().graphStore(store).build()) {
            importer.importGraph(ImportRequest.ofEntities(List.of(CandidateNode.of("Person",
                    Map.of("first_name", "Jonathan", "last_name", "Smith", "email", "jon@example.com")))));

            Page<ReviewItem> pending = importer.reviews().pending(PageRequest.first(10));
            assertEquals(1, pending.totalElements());

            ReviewOutcome outcome = importer.reviews().approve(pending.content().get(0).getId(), "reviewer-1", null);

            assertEquals(existing.nodeId(), outcome.appliedNodeId());
            assertEquals("jon@example.com", store.findByNodeId(existing.nodeId()).orElseThrow().property("email"));
            assertEquals(0, importer.reviews().countPending());
        }
    }

    @Test
    @DisplayName("A closed importer rejects further calls")
    void closed() {
        KnowledgeGraphImporter importer = KnowledgeGraphImporter.builder().build();
        importer.close();
        importer.close();

        assertThrows(IllegalStateException.class,
                () -> importer.importGraph(ImportRequest.ofEntities(List.of())));
        assertThrows(IllegalStateException.class, importer::reviews);
    }

    @Test
    @DisplayName("A null request is rejected")
    void nullRequest() {
        try (KnowledgeGraphImporter importer = KnowledgeGraphImporter.builder().build()) {
            assertThrows(IllegalArgumentException.class, () -> importer.importGraph(null));
        }
    }

    @Test
    @DisplayName("A supplied store is not closed with the importer")
    void suppliedStoreNotClosed() {
        GraphStore store = mock(GraphStore.class);

        KnowledgeGraphImporter.builder().graphStore(store).build().close();

        verify(store, never()).close();
    }

    @Test
    @DisplayName("Options are required")
    void optionsRequired() {
        assertThrows(IllegalStateException.class, () -> KnowledgeGraphImporter.builder().options(null).build());
    }
}
