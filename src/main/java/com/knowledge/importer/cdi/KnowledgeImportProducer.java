package com.knowledge.importer.cdi;

import com.knowledge.importer.api.KnowledgeGraphImporter;
import com.knowledge.importer.embedding.CachingEmbeddingGateway;
import com.knowledge.importer.embedding.EmbeddingCacheConfig;
import com.knowledge.importer.embedding.EmbeddingGateway;
import com.knowledge.importer.embedding.NoOpEmbeddingGateway;
import com.knowledge.importer.embedding.OpenAIEmbeddingGateway;
import com.knowledge.importer.graph.CypherGraphStore;
import com.knowledge.importer.graph.FalkorDBConnection;
import com.knowledge.importer.graph.GraphConnection;
import com.knowledge.importer.graph.InMemoryGraphStore;
import com.knowledge.importer.importer.ImportOptions;
import com.knowledge.importer.review.GraphReviewQueue;
import com.knowledge.importer.review.ReviewService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the importer from MicroProfile Config properties.
 *
 * <pre>
 * knowledge-import.store=falkordb
 * knowledge-import.falkordb.host=localhost
 * knowledge-import.falkordb.port=6379
 * knowledge-import.falkordb.graph-name=knowledge
 * knowledge-import.embedding.enabled=true
 * knowledge-import.embedding.api-key=sk-...
 * </pre>
 *
 * <p>With the {@code memory} store, nodes and reviews live only for the lifetime of the bean.
 * With {@code falkordb}, review records are stored in the same graph.</p>
 */
@ApplicationScoped
public class KnowledgeImportProducer {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeImportProducer.class);

    static final String STORE_MEMORY = "memory";
    static final String STORE_FALKORDB = "falkordb";

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-import.store", defaultValue = STORE_MEMORY)
    String store;

    @Inject
    @ConfigProperty(name = "knowledge-import.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "knowledge-import.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "knowledge-import.falkordb.graph-name", defaultValue = "knowledge")
    String falkordbGraphName;

    // ── Embeddings ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.enabled", defaultValue = "false")
    boolean embeddingEnabled;

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.base-url", defaultValue = OpenAIEmbeddingGateway.DEFAULT_BASE_URL)
    String embeddingBaseUrl;

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.api-key")
    Optional<String> embeddingApiKey;

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.model", defaultValue = OpenAIEmbeddingGateway.DEFAULT_MODEL)
    String embeddingModel;

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.dimensions", defaultValue = "1536")
    int embeddingDimensions;

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.timeout-seconds", defaultValue = "10")
    int embeddingTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.cache.max-size", defaultValue = "10000")
    int embeddingCacheMaxSize;

    @Inject
    @ConfigProperty(name = "knowledge-import.embedding.cache.ttl-seconds", defaultValue = "3600")
    int embeddingCacheTtlSeconds;

    // ── Import options ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "knowledge-import.import.dry-run", defaultValue = "false")
    boolean dryRun;

    @Inject
    @ConfigProperty(name = "knowledge-import.import.enable-vector-search", defaultValue = "true")
    boolean enableVectorSearch;

    @Inject
    @ConfigProperty(name = "knowledge-import.import.similarity-threshold", defaultValue = "0.8")
    double similarityThreshold;

    @Inject
    @ConfigProperty(name = "knowledge-import.import.enable-human-review", defaultValue = "true")
    boolean enableHumanReview;

    @Inject
    @ConfigProperty(name = "knowledge-import.import.batch-size", defaultValue = "50")
    int batchSize;

    @Inject
    @ConfigProperty(name = "knowledge-import.import.concurrency", defaultValue = "4")
    int concurrency;

    @Inject
    @ConfigProperty(name = "knowledge-import.import.candidate-timeout-seconds", defaultValue = "30")
    int candidateTimeoutSeconds;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ImportOptions importOptions() {
        return ImportOptions.builder()
                .dryRun(dryRun)
                .enableVectorSearch(enableVectorSearch)
                .similarityThreshold(similarityThreshold)
                .enableHumanReview(enableHumanReview)
                .batchSize(batchSize)
                .concurrency(concurrency)
                .candidateTimeout(Duration.ofSeconds(candidateTimeoutSeconds))
                .build();
    }

    @Produces
    @ApplicationScoped
    public KnowledgeGraphImporter knowledgeGraphImporter(ImportOptions options) {
        KnowledgeGraphImporter.Builder builder = KnowledgeGraphImporter.builder()
                .embeddingGateway(createEmbeddingGateway())
                .options(options);

        if (STORE_FALKORDB.equalsIgnoreCase(store)) {
            log.info("Producing KnowledgeGraphImporter: falkordb={}:{}/{}",
                    falkordbHost, falkordbPort, falkordbGraphName);
            GraphConnection connection = new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
            builder.graphStore(new CypherGraphStore(connection, embeddingDimensions, true))
                    .reviewQueue(new GraphReviewQueue(connection));
            return builder.build();
        }
        if (!STORE_MEMORY.equalsIgnoreCase(store)) {
            throw new IllegalArgumentException("Unknown knowledge-import.store '" + store
                    + "', expected memory or falkordb");
        }
        log.info("Producing KnowledgeGraphImporter: in-memory store");
        return builder.graphStore(new InMemoryGraphStore()).build();
    }

    /**
     * The produced importer does not own its store, so the store and its connection are closed here.
     */
    public void closeImporter(@Disposes KnowledgeGraphImporter importer) {
        log.info("Closing KnowledgeGraphImporter");
        importer.close();
        importer.graphStore().close();
    }

    @Produces
    @ApplicationScoped
    public ReviewService reviewService(KnowledgeGraphImporter importer) {
        return importer.reviews();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    EmbeddingGateway createEmbeddingGateway() {
        if (!embeddingEnabled) {
            log.info("Embeddings disabled; vector matching will not run");
            return new NoOpEmbeddingGateway();
        }
        if (embeddingApiKey.isEmpty() || embeddingApiKey.get().isBlank()) {
            log.warn("knowledge-import.embedding.api-key is not set; embeddings disabled");
            return new NoOpEmbeddingGateway();
        }
        OpenAIEmbeddingGateway gateway = OpenAIEmbeddingGateway.builder()
                .baseUrl(embeddingBaseUrl)
                .apiKey(embeddingApiKey.get())
                .model(embeddingModel)
                .dimensions(embeddingDimensions)
                .timeout(Duration.ofSeconds(embeddingTimeoutSeconds))
                .build();
        log.info("Embeddings enabled: model={} dimensions={}", embeddingModel, embeddingDimensions);
        return new CachingEmbeddingGateway(gateway,
                new EmbeddingCacheConfig(embeddingCacheMaxSize, embeddingCacheTtlSeconds));
    }
}
