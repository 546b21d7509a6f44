package com.knowledge.importer.cdi;

import com.knowledge.importer.api.KnowledgeGraphImporter;
import com.knowledge.importer.embedding.CachingEmbeddingGateway;
import com.knowledge.importer.embedding.NoOpEmbeddingGateway;
import com.knowledge.importer.embedding.OpenAIEmbeddingGateway;
import com.knowledge.importer.graph.InMemoryGraphStore;
import com.knowledge.importer.importer.ImportOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KnowledgeImportProducer Tests")
class KnowledgeImportProducerTest {

    private KnowledgeImportProducer producer;

    @BeforeEach
    void setUp() {
        producer = new KnowledgeImportProducer();
        producer.store = KnowledgeImportProducer.STORE_MEMORY;
        producer.falkordbHost = "localhost";
        producer.falkordbPort = 6379;
        producer.falkordbGraphName = "knowledge";
        producer.embeddingEnabled = false;
        producer.embeddingBaseUrl = OpenAIEmbeddingGateway.DEFAULT_BASE_URL;
        producer.embeddingApiKey = Optional.empty();
        producer.embeddingModel = OpenAIEmbeddingGateway.DEFAULT_MODEL;
        producer.embeddingDimensions = 1536;
        producer.embeddingTimeoutSeconds = 10;
        producer.embeddingCacheMaxSize = 100;
        producer.embeddingCacheTtlSeconds = 60;
        producer.dryRun = false;
        producer.enableVectorSearch = true;
        producer.similarityThreshold = 0.8;
        producer.enableHumanReview = true;
        producer.batchSize = 25;
        producer.concurrency = 2;
        producer.candidateTimeoutSeconds = 15;
    }

    @Test
    @DisplayName("Import options reflect the configured properties")
    void importOptions() {
        producer.dryRun = true;

        ImportOptions options = producer.importOptions();

        assertTrue(options.isDryRun());
        assertEquals(25, options.getBatchSize());
        assertEquals(2, options.getConcurrency());
        assertEquals(Duration.ofSeconds(15), options.getCandidateTimeout());
    }

    @Test
    @DisplayName("The memory store produces an in-memory importer")
    void memoryStore() {
        KnowledgeGraphImporter importer = producer.knowledgeGraphImporter(producer.importOptions());
        try {
            assertTrue(importer.graphStore() instanceof InMemoryGraphStore);
            assertEquals(25, importer.defaultOptions().getBatchSize());
            assertNotNull(producer.reviewService(importer));
        } finally {
            producer.closeImporter(importer);
        }
    }

    @Test
    @DisplayName("An unknown store is rejected")
    void unknownStore() {
        producer.store = "cassandra";
        ImportOptions options = producer.importOptions();

        assertThrows(IllegalArgumentException.class, () -> producer.knowledgeGraphImporter(options));
    }

    @Test
    @DisplayName("Embeddings stay disabled without an API key")
    void embeddingsNeedApiKey() {
        producer.embeddingEnabled = true;
        producer.embeddingApiKey = Optional.of("  ");

        assertTrue(producer.createEmbeddingGateway() instanceof NoOpEmbeddingGateway);
    }

    @Test
    @DisplayName("Enabled embeddings are cached")
    void embeddingsCached() {
        producer.embeddingEnabled = true;
        producer.embeddingApiKey = Optional.of("sk-test");

        assertTrue(producer.createEmbeddingGateway() instanceof CachingEmbeddingGateway);
        assertTrue(producer.createEmbeddingGateway().getModel().contains(OpenAIEmbeddingGateway.DEFAULT_MODEL));
    }

    @Test
    @DisplayName("Embeddings are off by default")
    void embeddingsDisabled() {
        assertTrue(producer.createEmbeddingGateway() instanceof NoOpEmbeddingGateway);
    }
}
