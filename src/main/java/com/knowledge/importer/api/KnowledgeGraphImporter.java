package com.knowledge.importer.api;

import com.knowledge.importer.embedding.EmbeddingGateway;
import com.knowledge.importer.embedding.NoOpEmbeddingGateway;
import com.knowledge.importer.graph.CypherGraphStore;
import com.knowledge.importer.graph.FalkorDBConnection;
import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.InMemoryGraphStore;
import com.knowledge.importer.importer.ImportCancellation;
import com.knowledge.importer.importer.ImportOptions;
import com.knowledge.importer.importer.ImportOrchestrator;
import com.knowledge.importer.importer.ImportStatistics;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.metrics.NoOpMetricsService;
import com.knowledge.importer.model.ImportRequest;
import com.knowledge.importer.normalize.PropertyNormalizer;
import com.knowledge.importer.review.InMemoryReviewQueue;
import com.knowledge.importer.review.ReviewQueue;
import com.knowledge.importer.review.ReviewService;
import com.knowledge.importer.review.ReviewSubmitter;
import com.knowledge.importer.tracing.NoOpTracingService;
import com.knowledge.importer.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point: imports candidate nodes and relationships into a property graph,
 * resolving each candidate against what is already stored.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (KnowledgeGraphImporter importer = KnowledgeGraphImporter.builder()
 *         .falkorDB("localhost", 6379, "knowledge", 1536)
 *         .embeddingGateway(OpenAIEmbeddingGateway.builder().apiKey(key).build())
 *         .build()) {
 *
 *     ImportStatistics stats = importer.importGraph(request);
 *     System.out.println(stats.summary());
 *
 *     // Ambiguous matches wait for a reviewer
 *     importer.reviews().pending(PageRequest.first(20));
 * }
 * </pre>
 */
public class KnowledgeGraphImporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphImporter.class);

    private final GraphStore graphStore;
    private final boolean ownsGraphStore;
    private final NodeMatcherRegistry registry;
    private final ImportOptions defaultOptions;
    private final ReviewSubmitter reviewSubmitter;
    private final ReviewService reviewService;
    private final ImportOrchestrator orchestrator;
    private final AtomicBoolean closed = new AtomicBoolean();

    private KnowledgeGraphImporter(Builder builder) {
        this.graphStore = builder.graphStore != null ? builder.graphStore : new InMemoryGraphStore();
        this.ownsGraphStore = builder.ownsGraphStore;
        this.registry = builder.registry != null
                ? builder.registry : new NodeMatcherRegistry(builder.options.getSimilarityThreshold());
        this.defaultOptions = builder.options;

        EmbeddingGateway embeddingGateway = builder.embeddingGateway != null
                ? builder.embeddingGateway : new NoOpEmbeddingGateway();
        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        PropertyNormalizer normalizer = builder.normalizer != null
                ? builder.normalizer : new PropertyNormalizer();
        ReviewQueue reviewQueue = builder.reviewQueue != null
                ? builder.reviewQueue : new InMemoryReviewQueue();

        this.reviewSubmitter = new ReviewSubmitter(reviewQueue);
        this.reviewService = new ReviewService(reviewQueue, graphStore);
        this.orchestrator = new ImportOrchestrator(graphStore, embeddingGateway, registry, normalizer,
                reviewSubmitter, metrics, tracing);

        log.info("importer.initialized store={} embeddingModel={}",
                graphStore.getClass().getSimpleName(), embeddingGateway.getModel());
    }

    // ========== Import API ==========

    public ImportStatistics importGraph(ImportRequest request) {
        return importGraph(request, defaultOptions);
    }

    public ImportStatistics importGraph(ImportRequest request, ImportOptions options) {
        return importGraph(request, options, new ImportCancellation());
    }

    /**
     * Runs an import that can be stopped between candidates through the given cancellation.
     *
     * @throws com.knowledge.importer.graph.GraphStoreUnavailableException if the store is unreachable
     * @throws IllegalStateException if this importer has been closed
     */
    public ImportStatistics importGraph(ImportRequest request, ImportOptions options,
                                        ImportCancellation cancellation) {
        ensureOpen();
        if (request == null) {
            throw new IllegalArgumentException("Import request must not be null");
        }
        return orchestrator.run(request, options != null ? options : defaultOptions, cancellation);
    }

    // ========== Review API ==========

    public ReviewService reviews() {
        ensureOpen();
        return reviewService;
    }

    public NodeMatcherRegistry registry() {
        return registry;
    }

    public GraphStore graphStore() {
        return graphStore;
    }

    public ImportOptions defaultOptions() {
        return defaultOptions;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        reviewSubmitter.close();
        if (ownsGraphStore) {
            try {
                graphStore.close();
            } catch (RuntimeException e) {
                log.warn("importer.close_failed error={}", e.getMessage(), e);
            }
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Importer has been closed");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphStore graphStore;
        private boolean ownsGraphStore = false;
        private EmbeddingGateway embeddingGateway;
        private ReviewQueue reviewQueue;
        private MetricsService metricsService;
        private TracingService tracingService;
        private NodeMatcherRegistry registry;
        private PropertyNormalizer normalizer;
        private ImportOptions options = ImportOptions.defaults();

        /**
         * Uses the given store. Defaults to an {@link InMemoryGraphStore}.
         */
        public Builder graphStore(GraphStore graphStore) {
            this.graphStore = graphStore;
            this.ownsGraphStore = false;
            return this;
        }

        /**
         * Connects to FalkorDB. The connection is owned by the importer and closed with it.
         */
        public Builder falkorDB(String host, int port, String graphName, int embeddingDimension) {
            this.graphStore = new CypherGraphStore(new FalkorDBConnection(host, port, graphName),
                    embeddingDimension, true);
            this.ownsGraphStore = true;
            return this;
        }

        /**
         * Defaults to {@link NoOpEmbeddingGateway}, which disables vector matching.
         */
        public Builder embeddingGateway(EmbeddingGateway embeddingGateway) {
            this.embeddingGateway = embeddingGateway;
            return this;
        }

        /**
         * Defaults to {@link InMemoryReviewQueue}.
         */
        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Uses a registry with custom matchers registered. Defaults to the built-in matchers.
         */
        public Builder registry(NodeMatcherRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder normalizer(PropertyNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Options used by {@link KnowledgeGraphImporter#importGraph(ImportRequest)}.
         */
        public Builder options(ImportOptions options) {
            this.options = options;
            return this;
        }

        public KnowledgeGraphImporter build() {
            if (options == null) {
                throw new IllegalStateException("ImportOptions are required");
            }
            return new KnowledgeGraphImporter(this);
        }
    }
}
