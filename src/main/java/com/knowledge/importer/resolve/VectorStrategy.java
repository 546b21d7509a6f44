package com.knowledge.importer.resolve;

import com.knowledge.importer.embedding.EmbeddingGateway;
import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.ScoredNode;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.similarity.CosineSimilarity;
import com.knowledge.importer.vector.SimilaritySearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Embeds the candidate (or reuses the vector it carries) and takes the closest stored node
 * of the same type when its similarity reaches the type's threshold.
 * The vector is left on the context so a new node can be created with it.
 */
public class VectorStrategy implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(VectorStrategy.class);

    public static final String NAME = "vector";

    private final SimilaritySearch similaritySearch;
    private final EmbeddingGateway embeddingGateway;
    private final NodeMatcherRegistry registry;
    private final MetricsService metrics;

    public VectorStrategy(SimilaritySearch similaritySearch, EmbeddingGateway embeddingGateway,
                          NodeMatcherRegistry registry, MetricsService metrics) {
        this.similaritySearch = similaritySearch;
        this.embeddingGateway = embeddingGateway;
        this.registry = registry;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<GraphNode> resolve(ResolutionContext context) {
        if (!context.vectorSearchEnabled()) {
            return Optional.empty();
        }
        float[] vector = embeddingFor(context);
        if (vector == null) {
            return Optional.empty();
        }
        context.embedding(vector);
        Optional<ScoredNode> best = similaritySearch.bestMatch(context.type(), vector, context.vectorThreshold());
        best.ifPresent(hit -> log.debug("resolve.vector_hit nodeId={} similarity={} threshold={}",
                hit.node().nodeId(), hit.similarity(), context.vectorThreshold()));
        return best.map(ScoredNode::node);
    }

    private float[] embeddingFor(ResolutionContext context) {
        float[] carried = CosineSimilarity.toVector(context.properties().get(GraphStore.EMBEDDING_PROPERTY));
        if (carried != null) {
            return carried;
        }
        String text = registry.embeddingTextFor(context.type(), context.properties());
        if (text == null || text.isBlank()) {
            return null;
        }
        Optional<float[]> embedded = embeddingGateway.embed(text);
        if (embedded.isEmpty() || embedded.get().length == 0) {
            metrics.incrementEmbeddingFailure();
            log.debug("resolve.no_embedding type={} model={}", context.type(), embeddingGateway.getModel());
            return null;
        }
        return embedded.get();
    }
}
